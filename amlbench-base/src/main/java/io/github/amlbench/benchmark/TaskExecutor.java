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

import io.github.amlbench.data.Dataset;
import io.github.amlbench.data.TaskType;
import io.github.amlbench.data.UnsupportedDatasetShapeException;
import io.github.amlbench.framework.Framework;
import io.github.amlbench.framework.FrameworkDefinition;
import io.github.amlbench.framework.MetaResult;
import io.github.amlbench.resources.ResourceBudget;
import io.github.amlbench.results.NoResult;
import io.github.amlbench.results.Result;
import io.github.amlbench.results.TaskResult;
import io.github.amlbench.task.DatasetReference;
import io.github.amlbench.task.TaskDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one framework on one task fold, with the dataset lifecycle and failure handling around it.
 * <p>
 * Once the dataset is loaded, {@link #execute} always returns a result: any exception from the
 * framework (or from scoring its output) becomes a {@link NoResult} carrying the truncated error
 * message. Failures to load the dataset are not caught.
 */
public class TaskExecutor {
    private static final Logger logger = LoggerFactory.getLogger(TaskExecutor.class);

    private final BenchmarkContext context;

    public TaskExecutor(BenchmarkContext context) {
        this.context = context;
    }

    /**
     * @param template the fold's config, left untouched; the run gets its own specialized copy
     * @throws UnsupportedDatasetShapeException if the task has no dataset reference or one that
     *         cannot be loaded
     * @throws IOException if the dataset service fails
     */
    public Result execute(TaskDefinition task, TaskConfig template, Framework framework) throws IOException {
        Dataset dataset = load(task, template.getFold());
        try {
            TaskResult taskResult = new TaskResult(task, template.getFold(), context.getSettings().getPredictionsDir(),
                    context.getMetricEvaluator(), context.getMode());
            TaskConfig config = specialize(template, framework, TaskType.of(dataset), taskResult);
            String version = framework.getDefinition().getVersion();
            try {
                logger.info("Running task {} on framework {} with config:\n{}", task.getName(), framework.getName(), config);
                MetaResult meta = framework.getAdapter().run(dataset, config);
                dataset.release();
                return taskResult.computeScores(config, version, meta);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                logger.error("Task {} fold {} failed on framework {}.", task.getName(), config.getFold(), framework.getName(), e);
                String info = NoResult.truncateMessage(messageOf(e), context.getSettings().getErrorMaxLength());
                return taskResult.noResult(config, version, info);
            }
        } finally {
            dataset.release();
        }
    }

    private Dataset load(TaskDefinition task, int fold) throws IOException {
        DatasetReference ref = task.getDataset();
        if (ref == null) {
            throw new UnsupportedDatasetShapeException("Task " + task.getName() + " has no dataset reference");
        }
        switch (ref.kind()) {
            case OPENML_TASK:
                logger.debug("Loading dataset of task {} fold {} from {}.", task.getName(), fold, ref.publicId());
                return context.getDatasets().load(ref.numericId(), fold);
            case OPENML_DATASET:
                throw new UnsupportedDatasetShapeException("Task " + task.getName()
                        + ": dataset references (" + ref.publicId() + ") are not supported, use a task id");
            default:
                throw new UnsupportedDatasetShapeException("Task " + task.getName() + ": raw datasets are not supported");
        }
    }

    /**
     * The config of this very run: framework params with the {@code f.*} overrides merged over
     * them, a fresh resource budget, and the framework's predictions file.
     */
    TaskConfig specialize(TaskConfig template, Framework framework, TaskType type, TaskResult taskResult) {
        FrameworkDefinition def = framework.getDefinition();
        Map<String, Object> params = new LinkedHashMap<>(def.getParams());
        params.putAll(context.getSettings().getFrameworkParamOverrides());

        ResourceBudget budget = context.getResourceEstimator()
                .estimate(template.getName(), template.getCores(), template.getMaxMemSizeMb());

        return template.toBuilder()
                .withType(type)
                .withFramework(framework.getName())
                .withFrameworkParams(params)
                .withBudget(budget)
                .withOutputPredictionsFile(taskResult.predictionsFile(framework.getName()))
                .build();
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
