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

package io.github.amlbench.example;

import io.github.amlbench.benchmark.TaskConfig;
import io.github.amlbench.data.TaskType;
import io.github.amlbench.framework.MetaResult;
import io.github.amlbench.results.BasicMetrics;
import io.github.amlbench.results.Result;
import io.github.amlbench.results.TaskResult;
import io.github.amlbench.task.DatasetReference;
import io.github.amlbench.task.TaskDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Input files and results shared by the tests of this module.
 */
public class ExampleFixtures {
    public static final int IRIS_TASK_ID = 59;

    /**
     * Writes the splits of a small iris-like task: the training splits are mostly "setosa", the
     * test splits hold one "setosa" and one "versicolor".
     */
    public static void writeIris(Path inputDir, int folds) throws IOException {
        Path taskDir = inputDir.resolve(Integer.toString(IRIS_TASK_ID));
        Files.createDirectories(taskDir);
        for (int fold = 0; fold < folds; fold++) {
            Files.writeString(taskDir.resolve("train_" + fold + ".csv"),
                    "sepal_length,petal_length,class\n"
                            + "5.1,1.4,setosa\n"
                            + "4.9,1.3,setosa\n"
                            + "7.0,4.7,versicolor\n"
                            + "5.0, 1.5 ,setosa\n");
            Files.writeString(taskDir.resolve("test_" + fold + ".csv"),
                    "sepal_length,petal_length,class\n"
                            + "5.4,1.4,setosa\n"
                            + "6.4,4.5,versicolor\n");
        }
    }

    /** A scored iris result of the given framework, on accuracy. */
    public static Result irisResult(String framework, int fold, Path dir) {
        TaskDefinition iris = new TaskDefinition.Builder("iris")
                .withDataset(DatasetReference.openmlTask(IRIS_TASK_ID))
                .withMetric("acc")
                .build();
        TaskConfig config = new TaskConfig.Builder("iris", fold)
                .withType(TaskType.CLASSIFICATION)
                .withFramework(framework)
                .withMetrics(List.of("acc"))
                .build();
        MetaResult meta = new MetaResult.Builder()
                .withPredictions(List.of("setosa", "setosa"), List.of("setosa", "versicolor"))
                .build();
        return new TaskResult(iris, fold, dir, new BasicMetrics(), "local").computeScores(config, "latest", meta);
    }

    /** A scored cholesterol result of the given framework, on rmse and mae. */
    public static Result cholesterolResult(String framework, int fold, Path dir) {
        TaskDefinition cholesterol = new TaskDefinition.Builder("cholesterol")
                .withDataset(DatasetReference.openmlTask(2295))
                .withMetrics(List.of("rmse", "mae"))
                .build();
        TaskConfig config = new TaskConfig.Builder("cholesterol", fold)
                .withType(TaskType.REGRESSION)
                .withFramework(framework)
                .withMetrics(List.of("rmse", "mae"))
                .build();
        MetaResult meta = new MetaResult.Builder()
                .withPredictions(List.of("200", "250"), List.of("210", "240"))
                .build();
        return new TaskResult(cholesterol, fold, dir, new BasicMetrics(), "local").computeScores(config, "latest", meta);
    }

    public static void deleteQuietly(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    // best effort
                }
            });
        } catch (IOException e) {
            // best effort
        }
    }
}
