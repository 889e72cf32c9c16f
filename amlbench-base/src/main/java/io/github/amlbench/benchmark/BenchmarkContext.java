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

import io.github.amlbench.data.DatasetService;
import io.github.amlbench.resources.ResourceEstimator;
import io.github.amlbench.resources.SystemResources;
import io.github.amlbench.results.BasicMetrics;
import io.github.amlbench.results.MetricEvaluator;

import java.util.Objects;

/**
 * The collaborators shared by every job of a benchmark: where datasets come from, how resources
 * are estimated, how metrics are scored, and the global settings.
 */
public class BenchmarkContext {
    public static final String LOCAL_MODE = "local";

    private final DatasetService datasets;
    private final ResourceEstimator resourceEstimator;
    private final MetricEvaluator metricEvaluator;
    private final BenchmarkSettings settings;
    private final String mode;

    public BenchmarkContext(DatasetService datasets, ResourceEstimator resourceEstimator,
                            MetricEvaluator metricEvaluator, BenchmarkSettings settings, String mode) {
        this.datasets = Objects.requireNonNull(datasets, "datasets");
        this.resourceEstimator = Objects.requireNonNull(resourceEstimator, "resourceEstimator");
        this.metricEvaluator = Objects.requireNonNull(metricEvaluator, "metricEvaluator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    /**
     * A context running jobs on this machine, reading live system figures and scoring with
     * {@link BasicMetrics}.
     */
    public static BenchmarkContext local(DatasetService datasets, BenchmarkSettings settings) {
        return new BenchmarkContext(datasets,
                new ResourceEstimator(SystemResources.local(), settings.getOsMemSizeMb()),
                new BasicMetrics(),
                settings,
                LOCAL_MODE);
    }

    public DatasetService getDatasets() {
        return datasets;
    }

    public ResourceEstimator getResourceEstimator() {
        return resourceEstimator;
    }

    public MetricEvaluator getMetricEvaluator() {
        return metricEvaluator;
    }

    public BenchmarkSettings getSettings() {
        return settings;
    }

    /** Where jobs run, recorded in every result row and used as job scope. */
    public String getMode() {
        return mode;
    }
}
