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

import io.github.amlbench.data.TaskType;
import io.github.amlbench.resources.ResourceBudget;
import io.github.amlbench.task.TaskDefinition;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of one framework run on one task fold, as handed to
 * {@link io.github.amlbench.framework.FrameworkAdapter#run}.
 * <p>
 * A template is built once per fold with {@link #template}; each run derives its own copy through
 * {@link #toBuilder()}, filling in the task type, framework, resource budget and predictions file.
 * The template itself never changes.
 * <p>
 * The primary metric is always the first of {@link #getMetrics()}.
 */
public final class TaskConfig {
    private final String name;
    private final int fold;
    private final TaskType type;
    private final String framework;
    private final Map<String, Object> frameworkParams;
    private final List<String> metrics;
    private final Integer seed;
    private final int maxRuntimeSeconds;
    private final int cores;
    private final long maxMemSizeMb;
    private final Path inputDir;
    private final Path outputDir;
    private final Path outputPredictionsFile;
    private final ResourceBudget budget;

    private TaskConfig(Builder builder) {
        this.name = builder.name;
        this.fold = builder.fold;
        this.type = builder.type;
        this.framework = builder.framework;
        this.frameworkParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.frameworkParams));
        this.metrics = List.copyOf(builder.metrics);
        this.seed = builder.seed;
        this.maxRuntimeSeconds = builder.maxRuntimeSeconds;
        this.cores = builder.cores;
        this.maxMemSizeMb = builder.maxMemSizeMb;
        this.inputDir = builder.inputDir;
        this.outputDir = builder.outputDir;
        this.outputPredictionsFile = builder.outputPredictionsFile;
        this.budget = builder.budget;
    }

    /**
     * The per-fold template: the task definition's values, with the global task overrides applied.
     * Cores and memory are the requested ones until a budget is assigned.
     */
    public static TaskConfig template(TaskDefinition task, int fold, BenchmarkSettings settings) {
        TaskOverrides overrides = settings.getTaskOverrides();
        List<String> metrics = overrides.getMetrics() != null ? overrides.getMetrics() : task.getMetrics();
        if (overrides.getMetric() != null) {
            metrics = withPrimary(overrides.getMetric(), metrics);
        }
        return new Builder(task.getName(), fold)
                .withMetrics(metrics)
                .withSeed(overrides.getSeed() != null ? overrides.getSeed() : task.getSeed())
                .withMaxRuntimeSeconds(overrides.getMaxRuntimeSeconds() != null
                        ? overrides.getMaxRuntimeSeconds() : task.getMaxRuntimeSeconds())
                .withCores(task.getCores())
                .withMaxMemSizeMb(task.getMaxMemSizeMb())
                .withInputDir(settings.getInputDir())
                .withOutputDir(settings.getOutputDir())
                .build();
    }

    private static List<String> withPrimary(String primary, List<String> metrics) {
        List<String> ordered = new ArrayList<>();
        ordered.add(primary);
        for (String m : metrics) {
            if (!m.equals(primary)) {
                ordered.add(m);
            }
        }
        return ordered;
    }

    public String getName() {
        return name;
    }

    public int getFold() {
        return fold;
    }

    /** Classification or regression; null on a template. */
    public TaskType getType() {
        return type;
    }

    /** Framework running this config; null on a template. */
    public String getFramework() {
        return framework;
    }

    public Map<String, Object> getFrameworkParams() {
        return frameworkParams;
    }

    public String getMetric() {
        return metrics.get(0);
    }

    public List<String> getMetrics() {
        return metrics;
    }

    public Integer getSeed() {
        return seed;
    }

    /** Time budget of the run. Frameworks are expected to honour it, nothing enforces it. */
    public int getMaxRuntimeSeconds() {
        return maxRuntimeSeconds;
    }

    public int getCores() {
        return cores;
    }

    public long getMaxMemSizeMb() {
        return maxMemSizeMb;
    }

    public Path getInputDir() {
        return inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /** Where the framework should write its predictions; null on a template. */
    public Path getOutputPredictionsFile() {
        return outputPredictionsFile;
    }

    /** Budget the cores and memory come from; null on a template. */
    public ResourceBudget getBudget() {
        return budget;
    }

    public Builder toBuilder() {
        return new Builder(name, fold)
                .withType(type)
                .withFramework(framework)
                .withFrameworkParams(frameworkParams)
                .withMetrics(metrics)
                .withSeed(seed)
                .withMaxRuntimeSeconds(maxRuntimeSeconds)
                .withCores(cores)
                .withMaxMemSizeMb(maxMemSizeMb)
                .withInputDir(inputDir)
                .withOutputDir(outputDir)
                .withOutputPredictionsFile(outputPredictionsFile)
                .withBudget(budget);
    }

    @Override
    public String toString() {
        return "TaskConfig{" +
                "name='" + name + '\'' +
                ", fold=" + fold +
                ", type=" + type +
                ", framework='" + framework + '\'' +
                ", frameworkParams=" + frameworkParams +
                ", metrics=" + metrics +
                ", seed=" + seed +
                ", maxRuntimeSeconds=" + maxRuntimeSeconds +
                ", cores=" + cores +
                ", maxMemSizeMb=" + maxMemSizeMb +
                ", outputPredictionsFile=" + outputPredictionsFile +
                '}';
    }

    public static class Builder {
        private final String name;
        private final int fold;
        private TaskType type;
        private String framework;
        private Map<String, Object> frameworkParams = Map.of();
        private List<String> metrics = List.of("acc");
        private Integer seed;
        private int maxRuntimeSeconds = 3600;
        private int cores = -1;
        private long maxMemSizeMb = -1;
        private Path inputDir;
        private Path outputDir;
        private Path outputPredictionsFile;
        private ResourceBudget budget;

        public Builder(String name, int fold) {
            this.name = name;
            this.fold = fold;
        }

        public Builder withType(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder withFramework(String framework) {
            this.framework = framework;
            return this;
        }

        public Builder withFrameworkParams(Map<String, Object> frameworkParams) {
            this.frameworkParams = frameworkParams == null ? Map.of() : frameworkParams;
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

        public Builder withMaxMemSizeMb(long maxMemSizeMb) {
            this.maxMemSizeMb = maxMemSizeMb;
            return this;
        }

        public Builder withInputDir(Path inputDir) {
            this.inputDir = inputDir;
            return this;
        }

        public Builder withOutputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder withOutputPredictionsFile(Path outputPredictionsFile) {
            this.outputPredictionsFile = outputPredictionsFile;
            return this;
        }

        /** Assigns a budget, replacing cores and memory with the budgeted values. */
        public Builder withBudget(ResourceBudget budget) {
            this.budget = budget;
            if (budget != null) {
                this.cores = budget.cores();
                this.maxMemSizeMb = budget.memoryMb();
            }
            return this;
        }

        public TaskConfig build() {
            if (metrics == null || metrics.isEmpty()) {
                throw new IllegalArgumentException("Task " + name + " needs at least one metric");
            }
            return new TaskConfig(this);
        }
    }
}
