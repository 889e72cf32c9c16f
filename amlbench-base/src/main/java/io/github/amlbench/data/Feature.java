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

package io.github.amlbench.data;

import java.util.List;
import java.util.Objects;

/**
 * Column metadata of a dataset.
 */
public final class Feature {
    private final int index;
    private final String name;
    private final boolean categorical;
    private final List<String> values;

    /**
     * @param index column position in the data splits
     * @param name column name
     * @param categorical whether the column holds categories rather than continuous numbers
     * @param values the distinct categories for a categorical column, empty otherwise
     */
    public Feature(int index, String name, boolean categorical, List<String> values) {
        this.index = index;
        this.name = Objects.requireNonNull(name, "name");
        this.categorical = categorical;
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public boolean isCategorical() {
        return categorical;
    }

    public List<String> values() {
        return values;
    }

    @Override
    public String toString() {
        return name + (categorical ? values.toString() : "(numeric)");
    }
}
