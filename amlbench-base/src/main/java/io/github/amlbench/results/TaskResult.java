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

import io.github.amlbench.benchmark.TaskConfig;
import io.github.amlbench.framework.MetaResult;
import io.github.amlbench.task.DatasetReference;
import io.github.amlbench.task.TaskDefinition;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the {@link Result} of one task fold, either from a framework's {@link MetaResult} or as a
 * {@link NoResult} after a failure.
 */
public class TaskResult {
    private final TaskDefinition task;
    private final int fold;
    private final Path predictionsDir;
    private final MetricEvaluator evaluator;
    private final String mode;

    /**
     * @param mode where the run happens, recorded in each row (e.g. "local")
     */
    public TaskResult(TaskDefinition task, int fold, Path predictionsDir, MetricEvaluator evaluator, String mode) {
        this.task = task;
        this.fold = fold;
        this.predictionsDir = predictionsDir;
        this.evaluator = evaluator;
        this.mode = mode;
    }

    /** Where the given framework saves its predictions for this task fold. */
    public Path predictionsFile(String framework) {
        return predictionsDir.resolve(framework.toLowerCase(Locale.ROOT) + "_" + task.getName() + "_" + fold + ".csv");
    }

    public ScoredResult computeScores(TaskConfig config, String frameworkVersion, MetaResult meta) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String metric : config.getMetrics()) {
            scores.put(metric, evaluator.score(metric, config.getType(), meta));
        }
        return new ScoredResult(identity(config, frameworkVersion), config.getMetrics(), scores,
                meta.getTrainingDurationSeconds(), meta.getModelsCount(), null);
    }

    /**
     * @param info diagnostic message, already truncated
     */
    public NoResult noResult(TaskConfig config, String frameworkVersion, String info) {
        return new NoResult(identity(config, frameworkVersion), config.getMetrics(), Double.NaN, info);
    }

    private Result.Identity identity(TaskConfig config, String frameworkVersion) {
        DatasetReference ref = task.getDataset();
        Map<String, Object> params = config.getFrameworkParams();
        return new Result.Identity(
                ref == null ? null : ref.publicId(),
                task.getName(),
                config.getFramework(),
                frameworkVersion,
                fold,
                mode,
                params == null || params.isEmpty() ? null : params.toString(),
                config.getSeed(),
                Instant.now().truncatedTo(ChronoUnit.SECONDS)
        );
    }
}
