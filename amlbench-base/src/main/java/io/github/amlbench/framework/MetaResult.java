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

package io.github.amlbench.framework;

import java.nio.file.Path;
import java.util.List;

/**
 * What an adapter hands back after a run: the test predictions aligned with the ground truth,
 * plus optional facts the adapter knows about its own run.
 */
public final class MetaResult {
    private final List<String> predictions;
    private final List<String> truth;
    private final Path predictionsFile;
    private final double trainingDurationSeconds;
    private final Integer modelsCount;

    private MetaResult(Builder builder) {
        this.predictions = List.copyOf(builder.predictions);
        this.truth = List.copyOf(builder.truth);
        this.predictionsFile = builder.predictionsFile;
        this.trainingDurationSeconds = builder.trainingDurationSeconds;
        this.modelsCount = builder.modelsCount;
    }

    public List<String> getPredictions() {
        return predictions;
    }

    public List<String> getTruth() {
        return truth;
    }

    /** Where the adapter saved the predictions, or null. */
    public Path getPredictionsFile() {
        return predictionsFile;
    }

    /** Training duration reported by the adapter, NaN when it does not measure it. */
    public double getTrainingDurationSeconds() {
        return trainingDurationSeconds;
    }

    /** Number of models trained, or null when unknown. */
    public Integer getModelsCount() {
        return modelsCount;
    }

    public static class Builder {
        private List<String> predictions = List.of();
        private List<String> truth = List.of();
        private Path predictionsFile;
        private double trainingDurationSeconds = Double.NaN;
        private Integer modelsCount;

        public Builder withPredictions(List<String> predictions, List<String> truth) {
            if (predictions.size() != truth.size()) {
                throw new IllegalArgumentException("Got " + predictions.size() + " predictions for " + truth.size() + " test rows");
            }
            this.predictions = predictions;
            this.truth = truth;
            return this;
        }

        public Builder withPredictionsFile(Path predictionsFile) {
            this.predictionsFile = predictionsFile;
            return this;
        }

        public Builder withTrainingDurationSeconds(double trainingDurationSeconds) {
            this.trainingDurationSeconds = trainingDurationSeconds;
            return this;
        }

        public Builder withModelsCount(Integer modelsCount) {
            this.modelsCount = modelsCount;
            return this;
        }

        public MetaResult build() {
            return new MetaResult(this);
        }
    }
}
