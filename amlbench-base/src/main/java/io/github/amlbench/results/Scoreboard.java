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

package io.github.amlbench.results;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered results of one framework, scoped either to a single task or to a whole benchmark,
 * never both.
 */
public final class Scoreboard {
    private final List<Result> rows;
    private final String frameworkName;
    private final String taskName;
    private final String benchmarkName;

    private Scoreboard(List<Result> rows, String frameworkName, String taskName, String benchmarkName) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.frameworkName = frameworkName;
        this.taskName = taskName;
        this.benchmarkName = benchmarkName;
    }

    public static Scoreboard forTask(List<Result> rows, String frameworkName, String taskName) {
        return new Scoreboard(rows, frameworkName, Objects.requireNonNull(taskName, "taskName"), null);
    }

    public static Scoreboard forBenchmark(List<Result> rows, String frameworkName, String benchmarkName) {
        return new Scoreboard(rows, frameworkName, null, Objects.requireNonNull(benchmarkName, "benchmarkName"));
    }

    public List<Result> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public String getFrameworkName() {
        return frameworkName;
    }

    /** The task this board is bound to, or null for a benchmark board. */
    public String getTaskName() {
        return taskName;
    }

    /** The benchmark this board is bound to, or null for a task board. */
    public String getBenchmarkName() {
        return benchmarkName;
    }

    public boolean isTaskScoped() {
        return taskName != null;
    }

    /** Name of the scope, used to key stores: "task_<name>" or "benchmark_<name>". */
    public String scope() {
        return isTaskScoped() ? "task_" + taskName : "benchmark_" + benchmarkName;
    }

    /** A new board with the same scope, holding this board's rows followed by the other's. */
    public Scoreboard append(Scoreboard other) {
        List<Result> merged = new ArrayList<>(rows);
        merged.addAll(other.rows);
        return new Scoreboard(merged, frameworkName, taskName, benchmarkName);
    }

    /** Union of the row columns, in first-seen order. */
    public List<String> columns() {
        Set<String> cols = new LinkedHashSet<>(Result.COLUMNS);
        for (Result r : rows) {
            cols.addAll(r.getMetrics());
        }
        return new ArrayList<>(cols);
    }

    public List<Map<String, Object>> asRows() {
        return rows.stream().map(Result::asRow).collect(Collectors.toList());
    }

    /**
     * Text table of the rows, leaving out the columns that are empty on every row.
     */
    public String asPrintableTable() {
        List<Map<String, Object>> data = asRows();
        List<String> cols = new ArrayList<>();
        for (String c : columns()) {
            if (data.stream().anyMatch(r -> !isEmpty(r.get(c)))) {
                cols.add(c);
            }
        }

        int[] widths = new int[cols.size()];
        List<List<String>> cells = new ArrayList<>();
        for (int i = 0; i < cols.size(); i++) {
            widths[i] = cols.get(i).length();
        }
        for (Map<String, Object> r : data) {
            List<String> line = new ArrayList<>(cols.size());
            for (int i = 0; i < cols.size(); i++) {
                String s = format(r.get(cols.get(i)));
                widths[i] = Math.max(widths[i], s.length());
                line.add(s);
            }
            cells.add(line);
        }

        StringBuilder sb = new StringBuilder();
        appendLine(sb, cols, widths);
        for (List<String> line : cells) {
            appendLine(sb, line, widths);
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, List<String> values, int[] widths) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append("  ");
            sb.append(String.format("%-" + widths[i] + "s", values.get(i)));
        }
        sb.append('\n');
    }

    private static boolean isEmpty(Object v) {
        return v == null || (v instanceof Double && ((Double) v).isNaN());
    }

    private static String format(Object v) {
        if (isEmpty(v)) return "";
        if (v instanceof Double) return String.format("%.6f", (Double) v);
        return v.toString();
    }

    @Override
    public String toString() {
        return "Scoreboard{" + scope() + ", framework=" + frameworkName + ", rows=" + rows.size() + '}';
    }
}
