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

package io.github.amlbench.example.yaml;

import io.github.amlbench.task.BenchmarkConfigurationException;
import io.github.amlbench.task.DatasetReference;
import io.github.amlbench.task.TaskCatalog;
import io.github.amlbench.task.TaskDefinition;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads benchmark definitions: YAML lists of tasks, e.g.
 * <pre>
 * - name: iris
 *   openml_task_id: 59
 *   folds: 10
 *   metric: [acc, logloss]
 *   max_runtime_seconds: 600
 * </pre>
 * A benchmark is looked up by name, first as {@code <name>.yaml} in the user definitions
 * directory, then in the bundled {@code benchmarks/} resources. A name ending in {@code .yaml}
 * is read as a path.
 */
public class BenchmarkDefinitions {
    static final String RESOURCE_DIR = "benchmarks/";

    private BenchmarkDefinitions() {
    }

    /**
     * @param definitionsDir user directory searched first, may be null
     * @throws BenchmarkConfigurationException if no definition of that name exists
     * @throws IOException if the definition cannot be read
     */
    public static TaskCatalog load(String benchmark, Path definitionsDir) throws IOException {
        if (benchmark.endsWith(".yaml") || benchmark.endsWith(".yml")) {
            Path file = Paths.get(benchmark);
            if (!Files.exists(file)) {
                throw new BenchmarkConfigurationException("Could not find benchmark definition " + file + ".");
            }
            String name = file.getFileName().toString().replaceFirst("\\.ya?ml$", "");
            try (InputStream in = Files.newInputStream(file)) {
                return parse(name, in);
            }
        }
        if (definitionsDir != null) {
            Path file = definitionsDir.resolve(benchmark + ".yaml");
            if (Files.exists(file)) {
                try (InputStream in = Files.newInputStream(file)) {
                    return parse(benchmark, in);
                }
            }
        }
        try (InputStream in = BenchmarkDefinitions.class.getClassLoader()
                .getResourceAsStream(RESOURCE_DIR + benchmark + ".yaml")) {
            if (in == null) {
                throw new BenchmarkConfigurationException("Could not find benchmark definition " + benchmark + ".");
            }
            return parse(benchmark, in);
        }
    }

    public static TaskCatalog parse(String benchmarkName, InputStream in) {
        Yaml yaml = new Yaml();
        Object raw = yaml.load(in);
        if (raw != null && !(raw instanceof List)) {
            throw new BenchmarkConfigurationException("Benchmark " + benchmarkName + " must be a list of tasks.");
        }
        List<TaskDefinition> tasks = new ArrayList<>();
        if (raw != null) {
            for (Object item : (List<?>) raw) {
                if (!(item instanceof Map)) {
                    throw new BenchmarkConfigurationException("Benchmark " + benchmarkName + ": invalid task entry " + item);
                }
                tasks.add(parseTask((Map<?, ?>) item));
            }
        }
        return new TaskCatalog(benchmarkName, tasks);
    }

    static TaskDefinition parseTask(Map<?, ?> fields) {
        Object name = fields.get("name");
        if (name == null) {
            throw new BenchmarkConfigurationException("Task without name: " + fields);
        }
        var builder = new TaskDefinition.Builder(name.toString());
        if (fields.get("folds") != null) {
            builder.withFolds(intValue(fields.get("folds")));
        }
        Object metric = fields.get("metric");
        if (metric instanceof List) {
            builder.withMetrics(((List<?>) metric).stream().map(Object::toString).collect(Collectors.toList()));
        } else if (metric != null) {
            builder.withMetric(metric.toString());
        }
        if (fields.get("seed") != null) {
            builder.withSeed(intValue(fields.get("seed")));
        }
        if (fields.get("max_runtime_seconds") != null) {
            builder.withMaxRuntimeSeconds(intValue(fields.get("max_runtime_seconds")));
        }
        if (fields.get("cores") != null) {
            builder.withCores(intValue(fields.get("cores")));
        }
        if (fields.get("max_mem_size_mb") != null) {
            builder.withMaxMemSizeMb(intValue(fields.get("max_mem_size_mb")));
        }
        builder.withEnabled(TaskDefinition.parseEnabled(fields.get("enabled")));

        if (fields.get("openml_task_id") != null) {
            builder.withDataset(DatasetReference.openmlTask(intValue(fields.get("openml_task_id"))));
        } else if (fields.get("openml_dataset_id") != null) {
            builder.withDataset(DatasetReference.openmlDataset(intValue(fields.get("openml_dataset_id"))));
        } else if (fields.get("dataset") != null) {
            builder.withDataset(DatasetReference.raw(fields.get("dataset").toString()));
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new BenchmarkConfigurationException(e.getMessage());
        }
    }

    private static int intValue(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new BenchmarkConfigurationException("Expected an integer, got " + value);
        }
    }
}
