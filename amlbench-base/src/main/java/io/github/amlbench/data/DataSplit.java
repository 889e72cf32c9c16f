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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One side (train or test) of a fold: rows of string cells, in column order.
 */
public final class DataSplit {
    private final Path path;
    private final List<String> header;
    private final List<List<String>> rows;

    public DataSplit(Path path, List<String> header, List<List<String>> rows) {
        this.path = path;
        this.header = List.copyOf(header);
        this.rows = rows;
    }

    /** The file the split was read from, or null for in-memory data. */
    public Path path() {
        return path;
    }

    public List<String> header() {
        return header;
    }

    public List<List<String>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /** Values of one column, in row order. */
    public List<String> column(int index) {
        List<String> values = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }
}
