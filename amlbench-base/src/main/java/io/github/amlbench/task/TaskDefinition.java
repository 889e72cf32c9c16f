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

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable definition of a benchmark task: a dataset reference, a number of cross-validation folds,
 * the metrics to report, and the resource hints handed to the framework.
 * <p>
 * Instances are created through the {@link Builder}, usually by a benchmark definition loader.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * TaskDefinition iris = new TaskDefinition.Builder("iris")
 *     .withDataset(DatasetReference.openmlTask(59))
 *     .withFolds(10)
 *     .withMetrics(List.of("acc", "logloss"))
 *     .withMaxRuntimeSeconds(600)
 *     .build();
 * }</pre>
 */
public final class TaskDefinition {
    private final String name;
    private final int folds;
    private final List<String> metrics;
    private final Integer seed;
    private final int maxRuntimeSeconds;
    private final int cores;
    private final int maxMemSizeMb;
    private final Boolean enabled;
    private final DatasetReference dataset;

    private TaskDefinition(Builder builder) {
        this.name = builder.name;
        this.folds = builder.folds;
        this.metrics = List.copyOf(builder.metrics);
        this.seed = builder.seed;
        this.maxRuntimeSeconds = builder.maxRuntimeSeconds;
        this.cores = builder.cores;
        this.maxMemSizeMb = builder.maxMemSizeMb;
        this.enabled = builder.enabled;
        this.dataset = builder.dataset;
    }

    public String getName() {
        return name;
    }

    public int getFolds() {
        return folds;
    }

    /** Ordered metrics; the first one is the primary metric. */
    public List<String> getMetrics() {
        return metrics;
    }

    /** Seed passed to the framework, or null to let the framework decide. */
    public Integer getSeed() {
        return seed;
    }

    public int getMaxRuntimeSeconds() {
        return maxRuntimeSeconds;
    }

    /** Requested cores, 0 or less meaning "all available". */
    public int getCores() {
        return cores;
    }

    /** Requested memory in MB, 0 or less meaning "unspecified". */
    public int getMaxMemSizeMb() {
        return maxMemSizeMb;
    }

    /** The dataset reference, or null if the definition declared none. */
    public DatasetReference getDataset() {
        return dataset;
    }

    /** A task is enabled unless its definition explicitly disables it. */
    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    public Builder toBuilder() {
        return new Builder(name)
                .withFolds(folds)
                .withMetrics(metrics)
                .withSeed(seed)
                .withMaxRuntimeSeconds(maxRuntimeSeconds)
                .withCores(cores)
                .withMaxMemSizeMb(maxMemSizeMb)
                .withEnabled(enabled)
                .withDataset(dataset);
    }

    /**
     * Interprets loosely typed enabled flags found in definition files.
     * {@code null} stays null (absent); strings such as "yes", "true", "on", "1" are true-like.
     */
    public static Boolean parseEnabled(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        String s = raw.toString().trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "y":
            case "yes":
            case "t":
            case "true":
            case "on":
            case "1":
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return "TaskDefinition{" +
                "name='" + name + '\'' +
                ", folds=" + folds +
                ", metrics=" + metrics +
                ", seed=" + seed +
                ", maxRuntimeSeconds=" + maxRuntimeSeconds +
                ", cores=" + cores +
                ", maxMemSizeMb=" + maxMemSizeMb +
                ", enabled=" + enabled +
                ", dataset=" + dataset +
                '}';
    }

    public static class Builder {
        private final String name;
        private int folds = 10;
        private List<String> metrics = List.of("acc");
        private Integer seed;
        private int maxRuntimeSeconds = 3600;
        private int cores = -1;
        private int maxMemSizeMb = -1;
        private Boolean enabled;
        private DatasetReference dataset;

        public Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder withFolds(int folds) {
            this.folds = folds;
            return this;
        }

        public Builder withMetric(String metric) {
            this.metrics = List.of(metric);
            return this;
        }

        public Builder withMetrics(List<String> metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder withSeed(Integer seed) {
            this.seed = seed;
            return this;
        }

        public Builder withMaxRuntimeSeconds(int maxRuntimeSeconds) {
            this.maxRuntimeSeconds = maxRuntimeSeconds;
            return this;
        }

        public Builder withCores(int cores) {
            this.cores = cores;
            return this;
        }

        public Builder withMaxMemSizeMb(int maxMemSizeMb) {
            this.maxMemSizeMb = maxMemSizeMb;
            return this;
        }

        public Builder withEnabled(Boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder withDataset(DatasetReference dataset) {
            this.dataset = dataset;
            return this;
        }

        public TaskDefinition build() {
            if (folds <= 0) {
                throw new IllegalArgumentException("Task " + name + " must declare at least one fold, got " + folds);
            }
            if (metrics == null || metrics.isEmpty()) {
                throw new IllegalArgumentException("Task " + name + " must declare at least one metric");
            }
            return new TaskDefinition(this);
        }
    }
}
