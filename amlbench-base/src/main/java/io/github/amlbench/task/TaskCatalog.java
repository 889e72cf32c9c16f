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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered collection of the task definitions of one benchmark. Lookups never reorder the
 * definitions: {@link #listEnabled()} returns them in the order they were declared.
 */
public class TaskCatalog {
    private final String benchmarkName;
    private final List<TaskDefinition> definitions;

    public TaskCatalog(String benchmarkName, List<TaskDefinition> definitions) {
        this.benchmarkName = benchmarkName;
        Set<String> seen = new LinkedHashSet<>();
        for (TaskDefinition def : definitions) {
            if (!seen.add(def.getName())) {
                throw new IllegalArgumentException("Duplicate task name " + def.getName() + " in benchmark " + benchmarkName);
            }
        }
        this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
    }

    public String getBenchmarkName() {
        return benchmarkName;
    }

    /** All definitions, enabled or not, in declaration order. */
    public List<TaskDefinition> all() {
        return definitions;
    }

    /** Definitions whose enabled flag is absent or true-like, in declaration order. */
    public List<TaskDefinition> listEnabled() {
        return definitions.stream()
                .filter(TaskDefinition::isEnabled)
                .collect(Collectors.toList());
    }

    /**
     * @throws UnknownTaskException if no definition has this name
     * @throws TaskDisabledException if the matching definition is disabled
     */
    public TaskDefinition get(String name) {
        TaskDefinition def = definitions.stream()
                .filter(d -> d.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new UnknownTaskException(name));
        if (!def.isEnabled()) {
            throw new TaskDisabledException(name);
        }
        return def;
    }

    /**
     * Resolves each name with {@link #get(String)}, keeping the requested order. A name given more
     * than once is resolved once, at its first position.
     */
    public List<TaskDefinition> get(List<String> names) {
        List<TaskDefinition> defs = new ArrayList<>(names.size());
        for (String name : new LinkedHashSet<>(names)) {
            defs.add(get(name));
        }
        return defs;
    }

    public int size() {
        return definitions.size();
    }
}
