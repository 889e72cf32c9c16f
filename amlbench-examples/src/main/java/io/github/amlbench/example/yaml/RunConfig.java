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

import io.github.amlbench.benchmark.BenchmarkSettings;
import io.github.amlbench.benchmark.TaskOverrides;
import io.github.amlbench.task.BenchmarkConfigurationException;
import org.yaml.snakeyaml.Yaml;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run-level configuration, merged from up to three sources, later ones winning:
 * <ol>
 *   <li>the bundled {@code config.yaml} holding the defaults,</li>
 *   <li>an optional user config file,</li>
 *   <li>{@code key=value} overrides from the command line, with dotted keys addressing nested
 *   sections (e.g. {@code job_scheduler.parallel_jobs=4}).</li>
 * </ol>
 * Nested sections are merged key by key. Keys prefixed {@code f.} and {@code t.} are not config
 * keys but framework and task overrides; they are kept aside and applied to the settings.
 */
public class RunConfig {
    static final String DEFAULT_RESOURCE = "config.yaml";

    private final Map<String, Object> values;
    private final Map<String, Object> overrides;

    private RunConfig(Map<String, Object> values, Map<String, Object> overrides) {
        this.values = values;
        this.overrides = overrides;
    }

    /**
     * Loads the bundled defaults.
     * @return the default configuration
     * @throws IOException if the bundled config cannot be read
     */
    public static RunConfig loadDefault() throws IOException {
        try (InputStream in = RunConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new FileNotFoundException("classpath:" + DEFAULT_RESOURCE);
            }
            return new RunConfig(readMap(in), new LinkedHashMap<>());
        }
    }

    /**
     * Loads the bundled defaults and merges the user config file over them.
     * @param userConfig the user config file, ignored if null
     * @throws IOException if a config file is missing or cannot be read
     */
    public static RunConfig load(Path userConfig) throws IOException {
        RunConfig config = loadDefault();
        if (userConfig == null) {
            return config;
        }
        if (!Files.exists(userConfig)) {
            throw new FileNotFoundException(userConfig.toAbsolutePath().toString());
        }
        try (InputStream in = Files.newInputStream(userConfig)) {
            return config.merge(readMap(in));
        }
    }

    /** A copy with the given map merged over this configuration. */
    public RunConfig merge(Map<String, Object> other) {
        Map<String, Object> merged = deepCopy(values);
        deepMerge(merged, other);
        return new RunConfig(merged, new LinkedHashMap<>(overrides));
    }

    /**
     * A copy with command-line overrides applied. Values are parsed as YAML scalars, so that
     * {@code 4} is a number and {@code true} a boolean.
     */
    public RunConfig withOverrides(Map<String, String> keyValues) {
        Map<String, Object> merged = deepCopy(values);
        Map<String, Object> prefixed = new LinkedHashMap<>(overrides);
        Yaml yaml = new Yaml();
        for (var e : keyValues.entrySet()) {
            Object value = yaml.load(e.getValue());
            if (e.getKey().startsWith("f.") || e.getKey().startsWith("t.")) {
                prefixed.put(e.getKey(), value);
            } else {
                put(merged, e.getKey(), value);
            }
        }
        return new RunConfig(merged, prefixed);
    }

    /** Value at a dotted path, or null. */
    public Object get(String path) {
        Object current = values;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
        }
        return current;
    }

    public Path getPath(String path) {
        Object value = get(path);
        return value == null ? null : expandHome(value.toString());
    }

    /** Directory holding the per-framework working directories. */
    public Path getFrameworksDir() {
        return getPath("frameworks.root_dir");
    }

    /** User directory searched for benchmark definitions before the bundled ones. */
    public Path getBenchmarkDefinitionsDir() {
        return getPath("benchmarks.definition_dir");
    }

    /** Optional user frameworks file, replacing the bundled one. */
    public Path getFrameworksFile() {
        return getPath("frameworks.definition_file");
    }

    public BenchmarkSettings toSettings() {
        var builder = new BenchmarkSettings.Builder()
                .withInputDir(getPath("input_dir"))
                .withOutputDir(getPath("output_dir"))
                .withSaveResults(bool("results.save", true))
                .withErrorMaxLength(integer("results.error_max_length", BenchmarkSettings.DEFAULT_ERROR_MAX_LENGTH))
                .withOsMemSizeMb(integer("benchmarks.os_mem_size_mb", BenchmarkSettings.DEFAULT_OS_MEM_SIZE_MB))
                .withParallelJobs(integer("job_scheduler.parallel_jobs", 1))
                .withJobStartDelay(Duration.ofMillis(Math.round(
                        number("job_scheduler.delay_between_jobs", 5) * 1000)))
                .withDrainAsync(bool("job_scheduler.drain_async", true));
        Object f = get("f");
        if (f instanceof Map) {
            ((Map<?, ?>) f).forEach((k, v) -> builder.withOverride("f." + k, v));
        }
        Object t = get("t");
        if (t instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> task = (Map<String, Object>) t;
            builder.withTaskOverrides(TaskOverrides.fromMap(task));
        }
        overrides.forEach(builder::withOverride);
        return builder.build();
    }

    private int integer(String path, int defaultValue) {
        return (int) number(path, defaultValue);
    }

    private double number(String path, double defaultValue) {
        Object value = get(path);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new BenchmarkConfigurationException("Config " + path + " expects a number, got " + value);
        }
    }

    private boolean bool(String path, boolean defaultValue) {
        Object value = get(path);
        if (value == null) {
            return defaultValue;
        }
        return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(value.toString());
    }

    private static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + path.substring(1));
        }
        return Paths.get(path);
    }

    private static Map<String, Object> readMap(InputStream in) {
        Object raw = new Yaml().load(in);
        if (raw == null) {
            return new LinkedHashMap<>();
        }
        if (!(raw instanceof Map)) {
            throw new BenchmarkConfigurationException("Config file must be a mapping, got " + raw);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) raw;
        return map;
    }

    @SuppressWarnings("unchecked")
    private static void put(Map<String, Object> target, String path, Object value) {
        String[] parts = path.split("\\.");
        Map<String, Object> current = target;
        for (int i = 0; i < parts.length - 1; i++) {
            Object next = current.get(parts[i]);
            if (!(next instanceof Map)) {
                next = new LinkedHashMap<String, Object>();
                current.put(parts[i], next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(parts[parts.length - 1], value);
    }

    @SuppressWarnings("unchecked")
    private static void deepMerge(Map<String, Object> target, Map<String, Object> source) {
        for (var e : source.entrySet()) {
            Object existing = target.get(e.getKey());
            if (existing instanceof Map && e.getValue() instanceof Map) {
                deepMerge((Map<String, Object>) existing, (Map<String, Object>) e.getValue());
            } else {
                target.put(e.getKey(), e.getValue());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (var e : source.entrySet()) {
            copy.put(e.getKey(), e.getValue() instanceof Map
                    ? deepCopy((Map<String, Object>) e.getValue())
                    : e.getValue());
        }
        return copy;
    }
}
