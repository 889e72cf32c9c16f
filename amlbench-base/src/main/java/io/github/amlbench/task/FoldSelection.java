/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.amlbench.task;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Which folds of a task to run: all of them, a single one, or an explicit list.
 * <p>
 * {@link #from(Object)} accepts the loosely typed values produced by configuration files and
 * command lines (null, an Integer, or a List of Integers) and rejects every other shape.
 */
public final class FoldSelection {
    private static final FoldSelection ALL = new FoldSelection(null);

    private final List<Integer> folds;

    private FoldSelection(List<Integer> folds) {
        this.folds = folds;
    }

    public static FoldSelection all() {
        return ALL;
    }

    public static FoldSelection of(int fold) {
        return new FoldSelection(List.of(fold));
    }

    /** Folds given more than once are kept once, at their first position. */
    public static FoldSelection of(List<Integer> folds) {
        return new FoldSelection(List.copyOf(new LinkedHashSet<>(folds)));
    }

    /**
     * @throws InvalidFoldSpecException if the value is neither null, an Integer, nor a list of Integers
     */
    public static FoldSelection from(Object spec) {
        if (spec == null) {
            return all();
        }
        if (spec instanceof Integer) {
            return of((Integer) spec);
        }
        if (spec instanceof List) {
            List<Integer> folds = new ArrayList<>();
            for (Object f : (List<?>) spec) {
                if (!(f instanceof Integer)) {
                    throw new InvalidFoldSpecException(spec);
                }
                folds.add((Integer) f);
            }
            return of(folds);
        }
        throw new InvalidFoldSpecException(spec);
    }

    public boolean isAll() {
        return folds == null;
    }

    /**
     * Resolves the selection against a task and validates every fold against its bounds.
     *
     * @throws FoldOutOfRangeException if any requested fold is outside [0, task.folds)
     */
    public List<Integer> resolve(TaskDefinition task) {
        if (folds == null) {
            return IntStream.range(0, task.getFolds()).boxed().collect(Collectors.toList());
        }
        for (int f : folds) {
            if (f < 0 || f >= task.getFolds()) {
                throw new FoldOutOfRangeException(f, task);
            }
        }
        return folds;
    }

    @Override
    public String toString() {
        return folds == null ? "all" : folds.toString();
    }
}
