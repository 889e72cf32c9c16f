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

package io.github.amlbench.benchmark;

import io.github.amlbench.task.BenchmarkConfigurationException;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global task overrides ({@code t.*} keys): values replacing those of every task definition when
 * present. Absent values are null.
 */
public final class TaskOverrides {
    private static final TaskOverrides NONE = new TaskOverrides(null, null, null, null);

    private final Integer maxRuntimeSeconds;
    private final String metric;
    private final List<String> metrics;
    private final Integer seed;

    public TaskOverrides(Integer maxRuntimeSeconds, String metric, List<String> metrics, Integer seed) {
        this.maxRuntimeSeconds = maxRuntimeSeconds;
        this.metric = metric;
        this.metrics = metrics == null ? null : List.copyOf(metrics);
        this.seed = seed;
    }

    public static TaskOverrides none() {
        return NONE;
    }

    public Integer getMaxRuntimeSeconds() {
        return maxRuntimeSeconds;
    }

    /** Primary metric, the one frameworks optimize and the {@code result} column reports. */
    public String getMetric() {
        return metric;
    }

    public List<String> getMetrics() {
        return metrics;
    }

    public Integer getSeed() {
        return seed;
    }

    public boolean isEmpty() {
        return maxRuntimeSeconds == null && metric == null && metrics == null && seed == null;
    }

    /**
     * Returns a copy with one more override. Keys are given without their {@code t.} prefix.
     *
     * @throws BenchmarkConfigurationException for keys other than max_runtime_seconds, metric,
     *         metrics and seed, or for values of the wrong shape
     */
    public TaskOverrides with(String key, Object value) {
        switch (key) {
            case "max_runtime_seconds":
                return new TaskOverrides(toInt(key, value), metric, metrics, seed);
            case "metric":
                return new TaskOverrides(maxRuntimeSeconds, value == null ? null : value.toString(), metrics, seed);
            case "metrics":
                return new TaskOverrides(maxRuntimeSeconds, metric, toList(value), seed);
            case "seed":
                return new TaskOverrides(maxRuntimeSeconds, metric, metrics, toInt(key, value));
            default:
                throw new BenchmarkConfigurationException("Unknown task override t." + key);
        }
    }

    /** Overrides read from a map of un-prefixed keys, e.g. the {@code t} section of a config file. */
    public static TaskOverrides fromMap(Map<String, ?> values) {
        TaskOverrides overrides = NONE;
        if (values != null) {
            for (Map.Entry<String, ?> e : values.entrySet()) {
                overrides = overrides.with(e.getKey(), e.getValue());
            }
        }
        return overrides;
    }

    private static Integer toInt(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new BenchmarkConfigurationException("Override t." + key + " expects an integer, got " + value);
        }
    }

    private static List<String> toList(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().map(Object::toString).collect(Collectors.toList());
        }
        return List.of(value.toString().split("\\s*,\\s*"));
    }

    @Override
    public String toString() {
        return "TaskOverrides{" +
                "maxRuntimeSeconds=" + maxRuntimeSeconds +
                ", metric=" + metric +
                ", metrics=" + metrics +
                ", seed=" + seed +
                '}';
    }
}
