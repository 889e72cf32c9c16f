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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable global settings of a benchmark run: where data is read and results are written, how
 * jobs are scheduled, and the overrides applied to every framework and task.
 * <p>
 * Settings are built through the {@link Builder}; {@link #toBuilder()} derives modified copies.
 * Later values win, so merging configuration sources is a matter of applying them in order on
 * the same builder.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * BenchmarkSettings settings = new BenchmarkSettings.Builder()
 *     .withInputDir(Path.of("data"))
 *     .withOutputDir(Path.of("results"))
 *     .withParallelJobs(4)
 *     .withOverride("t.max_runtime_seconds", 60)
 *     .withOverride("f.encode", true)
 *     .build();
 * }</pre>
 */
public class BenchmarkSettings {
    public static final int DEFAULT_ERROR_MAX_LENGTH = 200;
    public static final int DEFAULT_OS_MEM_SIZE_MB = 2048;
    public static final Duration DEFAULT_JOB_START_DELAY = Duration.ofSeconds(5);

    private final Path inputDir;
    private final Path outputDir;
    private final boolean saveResults;
    private final int errorMaxLength;
    private final int osMemSizeMb;
    private final int parallelJobs;
    private final Duration jobStartDelay;
    private final boolean drainAsync;
    private final Map<String, Object> frameworkParamOverrides;
    private final TaskOverrides taskOverrides;

    private BenchmarkSettings(Builder builder) {
        this.inputDir = builder.inputDir;
        this.outputDir = builder.outputDir;
        this.saveResults = builder.saveResults;
        this.errorMaxLength = builder.errorMaxLength;
        this.osMemSizeMb = builder.osMemSizeMb;
        this.parallelJobs = builder.parallelJobs;
        this.jobStartDelay = builder.jobStartDelay;
        this.drainAsync = builder.drainAsync;
        this.frameworkParamOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(builder.frameworkParamOverrides));
        this.taskOverrides = builder.taskOverrides;
    }

    /** Default settings: data under {@code ./input}, results under {@code ./results}. */
    public static BenchmarkSettings defaults() {
        return new Builder().build();
    }

    public Path getInputDir() {
        return inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /** Directory receiving the predictions files of every job. */
    public Path getPredictionsDir() {
        return outputDir.resolve("predictions");
    }

    /** Directory receiving the scoreboards of the run. */
    public Path getScoresDir() {
        return outputDir.resolve("scores");
    }

    public boolean isSaveResults() {
        return saveResults;
    }

    /** Maximum length of the diagnostic message of a {@link io.github.amlbench.results.NoResult}. */
    public int getErrorMaxLength() {
        return errorMaxLength;
    }

    /** Memory, in MB, left to the operating system when estimating job budgets. */
    public int getOsMemSizeMb() {
        return osMemSizeMb;
    }

    public int getParallelJobs() {
        return parallelJobs;
    }

    public Duration getJobStartDelay() {
        return jobStartDelay;
    }

    public boolean isDrainAsync() {
        return drainAsync;
    }

    /** Parameters merged over every framework definition's params ({@code f.*} overrides). */
    public Map<String, Object> getFrameworkParamOverrides() {
        return frameworkParamOverrides;
    }

    public TaskOverrides getTaskOverrides() {
        return taskOverrides;
    }

    public Builder toBuilder() {
        return new Builder()
                .withInputDir(inputDir)
                .withOutputDir(outputDir)
                .withSaveResults(saveResults)
                .withErrorMaxLength(errorMaxLength)
                .withOsMemSizeMb(osMemSizeMb)
                .withParallelJobs(parallelJobs)
                .withJobStartDelay(jobStartDelay)
                .withDrainAsync(drainAsync)
                .withFrameworkParamOverrides(frameworkParamOverrides)
                .withTaskOverrides(taskOverrides);
    }

    @Override
    public String toString() {
        return "BenchmarkSettings{" +
                "inputDir=" + inputDir +
                ", outputDir=" + outputDir +
                ", saveResults=" + saveResults +
                ", errorMaxLength=" + errorMaxLength +
                ", osMemSizeMb=" + osMemSizeMb +
                ", parallelJobs=" + parallelJobs +
                ", jobStartDelay=" + jobStartDelay +
                ", drainAsync=" + drainAsync +
                ", frameworkParamOverrides=" + frameworkParamOverrides +
                ", taskOverrides=" + taskOverrides +
                '}';
    }

    public static class Builder {
        private Path inputDir = Paths.get("input");
        private Path outputDir = Paths.get("results");
        private boolean saveResults = true;
        private int errorMaxLength = DEFAULT_ERROR_MAX_LENGTH;
        private int osMemSizeMb = DEFAULT_OS_MEM_SIZE_MB;
        private int parallelJobs = 1;
        private Duration jobStartDelay = DEFAULT_JOB_START_DELAY;
        private boolean drainAsync = true;
        private Map<String, Object> frameworkParamOverrides = new LinkedHashMap<>();
        private TaskOverrides taskOverrides = TaskOverrides.none();

        public Builder withInputDir(Path inputDir) {
            this.inputDir = inputDir;
            return this;
        }

        public Builder withOutputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder withSaveResults(boolean saveResults) {
            this.saveResults = saveResults;
            return this;
        }

        public Builder withErrorMaxLength(int errorMaxLength) {
            this.errorMaxLength = errorMaxLength;
            return this;
        }

        public Builder withOsMemSizeMb(int osMemSizeMb) {
            this.osMemSizeMb = osMemSizeMb;
            return this;
        }

        public Builder withParallelJobs(int parallelJobs) {
            this.parallelJobs = parallelJobs;
            return this;
        }

        public Builder withJobStartDelay(Duration jobStartDelay) {
            this.jobStartDelay = jobStartDelay;
            return this;
        }

        public Builder withDrainAsync(boolean drainAsync) {
            this.drainAsync = drainAsync;
            return this;
        }

        public Builder withFrameworkParamOverrides(Map<String, Object> overrides) {
            this.frameworkParamOverrides = new LinkedHashMap<>(overrides);
            return this;
        }

        public Builder withTaskOverrides(TaskOverrides taskOverrides) {
            this.taskOverrides = taskOverrides == null ? TaskOverrides.none() : taskOverrides;
            return this;
        }

        /**
         * Applies one prefixed override: {@code f.<param>} sets a framework parameter,
         * {@code t.<field>} a task override.
         *
         * @throws BenchmarkConfigurationException for any other prefix
         */
        public Builder withOverride(String key, Object value) {
            if (key.startsWith("f.") && key.length() > 2) {
                frameworkParamOverrides.put(key.substring(2), value);
            } else if (key.startsWith("t.") && key.length() > 2) {
                taskOverrides = taskOverrides.with(key.substring(2), value);
            } else {
                throw new BenchmarkConfigurationException("Override " + key + " must start with f. or t.");
            }
            return this;
        }

        public BenchmarkSettings build() {
            if (parallelJobs <= 0) {
                throw new BenchmarkConfigurationException("parallelJobs must be positive, got " + parallelJobs);
            }
            if (errorMaxLength < 4) {
                throw new BenchmarkConfigurationException("errorMaxLength must be at least 4, got " + errorMaxLength);
            }
            if (jobStartDelay == null || jobStartDelay.isNegative()) {
                throw new BenchmarkConfigurationException("jobStartDelay must not be negative");
            }
            return new BenchmarkSettings(this);
        }
    }
}
