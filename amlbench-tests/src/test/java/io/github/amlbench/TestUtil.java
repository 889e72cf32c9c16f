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

package io.github.amlbench;

import io.github.amlbench.benchmark.BenchmarkContext;
import io.github.amlbench.benchmark.BenchmarkSettings;
import io.github.amlbench.benchmark.TaskConfig;
import io.github.amlbench.data.DataSplit;
import io.github.amlbench.data.Dataset;
import io.github.amlbench.data.DatasetService;
import io.github.amlbench.data.Feature;
import io.github.amlbench.data.TabularDataset;
import io.github.amlbench.framework.FrameworkAdapter;
import io.github.amlbench.framework.FrameworkDefinition;
import io.github.amlbench.framework.FrameworkRegistry;
import io.github.amlbench.framework.MetaResult;
import io.github.amlbench.resources.ResourceEstimator;
import io.github.amlbench.resources.SystemResources;
import io.github.amlbench.results.BasicMetrics;
import io.github.amlbench.results.Result;
import io.github.amlbench.results.TaskResult;
import io.github.amlbench.task.DatasetReference;
import io.github.amlbench.task.TaskDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Fixtures shared by the tests: a tiny in-memory iris task, fake adapters and a registry holding them.
 */
public class TestUtil {
    public static final String CONSTANT = "constant";
    public static final String ALWAYS_THROWS = "always_throws";

    public static TaskDefinition iris(int folds) {
        return new TaskDefinition.Builder("iris")
                .withDataset(DatasetReference.openmlTask(59))
                .withFolds(folds)
                .withMetric("acc")
                .withMaxRuntimeSeconds(60)
                .build();
    }

    public static TaskDefinition task(String name, int folds) {
        return new TaskDefinition.Builder(name)
                .withDataset(DatasetReference.openmlTask(name.hashCode() & 0xffff))
                .withFolds(folds)
                .build();
    }

    /** Four training rows, two of them "setosa"; two test rows, one "setosa". */
    public static TabularDataset irisDataset() {
        Feature length = new Feature(0, "petal_length", false, List.of());
        Feature target = new Feature(1, "class", true, List.of("setosa", "versicolor"));
        List<String> header = List.of("petal_length", "class");
        DataSplit train = new DataSplit(null, header, List.of(
                List.of("1.4", "setosa"),
                List.of("1.3", "setosa"),
                List.of("4.7", "versicolor"),
                List.of("1.5", "setosa")));
        DataSplit test = new DataSplit(null, header, List.of(
                List.of("1.4", "setosa"),
                List.of("4.5", "versicolor")));
        return new TabularDataset("iris", target, List.of(length), train, test);
    }

    /**
     * Serves a fresh {@link #irisDataset()} for every load and keeps every dataset it served.
     */
    public static class InMemoryDatasetService implements DatasetService {
        public final List<Dataset> served = Collections.synchronizedList(new ArrayList<>());
        public final AtomicInteger loads = new AtomicInteger();

        @Override
        public Dataset load(int taskId, int fold) {
            loads.incrementAndGet();
            Dataset dataset = irisDataset();
            served.add(dataset);
            return dataset;
        }
    }

    /** Predicts the majority class of the training split. */
    public static FrameworkAdapter constantAdapter() {
        return (dataset, config) -> {
            List<String> truth = dataset.test().column(dataset.target().index());
            return new MetaResult.Builder()
                    .withPredictions(Collections.nCopies(truth.size(), "setosa"), truth)
                    .withModelsCount(1)
                    .build();
        };
    }

    public static FrameworkAdapter throwingAdapter(String message) {
        return (dataset, config) -> {
            throw new IllegalStateException(message);
        };
    }

    /** Registry holding {@link #CONSTANT} and {@link #ALWAYS_THROWS}. */
    public static FrameworkRegistry registry(Path frameworksDir) {
        return new FrameworkRegistry(frameworksDir)
                .register(new FrameworkDefinition.Builder(CONSTANT).withVersion("1.0").build(), constantAdapter())
                .register(new FrameworkDefinition.Builder(ALWAYS_THROWS).withVersion("1.0").build(),
                        throwingAdapter("this adapter always throws"));
    }

    /** Settings writing under the given directory, without delay between jobs. */
    public static BenchmarkSettings settings(Path outputDir) {
        return new BenchmarkSettings.Builder()
                .withInputDir(outputDir.resolve("input"))
                .withOutputDir(outputDir)
                .withJobStartDelay(Duration.ZERO)
                .build();
    }

    /** A context on a fixed machine: 8 cores, 16GB total of which 8GB available. */
    public static BenchmarkContext context(DatasetService datasets, BenchmarkSettings settings) {
        return new BenchmarkContext(datasets,
                new ResourceEstimator(SystemResources.fixed(8, 16384, 8192), settings.getOsMemSizeMb()),
                new BasicMetrics(),
                settings,
                BenchmarkContext.LOCAL_MODE);
    }

    /** A scored result of the iris task, reporting no duration of its own. */
    public static Result scoredResult(int fold, Path dir) {
        TaskDefinition iris = iris(10);
        TaskConfig config = TaskConfig.template(iris, fold, settings(dir)).toBuilder()
                .withFramework(CONSTANT)
                .build();
        MetaResult meta = new MetaResult.Builder()
                .withPredictions(List.of("a", "b"), List.of("a", "a"))
                .build();
        return new TaskResult(iris, fold, dir, new BasicMetrics(), BenchmarkContext.LOCAL_MODE)
                .computeScores(config, "1.0", meta);
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
