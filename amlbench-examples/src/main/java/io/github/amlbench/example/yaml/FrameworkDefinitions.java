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

import io.github.amlbench.framework.FrameworkDefinition;
import org.yaml.snakeyaml.Yaml;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Framework definitions loaded from a YAML frameworks file.
 * <p>
 * The file maps framework names to their definition:
 * <pre>
 * constantpredictor:
 *   version: 'latest'
 *
 * constantpredictor_enc:
 *   extends: constantpredictor
 *   params:
 *     encode: true
 * </pre>
 * Entries whose name starts with {@code __} only document the format and are ignored. The
 * {@code module} key names the adapter running the framework and defaults to the framework name.
 */
public class FrameworkDefinitions {
    /** Classpath location of the bundled frameworks file. */
    public static final String DEFAULT_RESOURCE = "frameworks.yaml";

    private FrameworkDefinitions() {
    }

    /**
     * Loads the bundled frameworks file.
     * @return the definitions, in file order
     * @throws IOException if the resource is missing or unreadable
     */
    public static List<FrameworkDefinition> loadDefault() throws IOException {
        try (InputStream in = FrameworkDefinitions.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new FileNotFoundException("classpath:" + DEFAULT_RESOURCE);
            }
            return load(in);
        }
    }

    /**
     * Loads the frameworks file at the given path.
     * @param file the frameworks file
     * @return the definitions, in file order
     * @throws IOException if the file is missing or unreadable
     */
    public static List<FrameworkDefinition> load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new FileNotFoundException(file.toAbsolutePath().toString());
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public static List<FrameworkDefinition> load(InputStream in) {
        Yaml yaml = new Yaml();
        Map<String, Object> raw = yaml.load(in);
        List<FrameworkDefinition> definitions = new ArrayList<>();
        if (raw == null) {
            return definitions;
        }
        for (var entry : raw.entrySet()) {
            if (entry.getKey().startsWith("__")) {
                continue;
            }
            definitions.add(parse(entry.getKey(), asMap(entry.getKey(), entry.getValue())));
        }
        return definitions;
    }

    static FrameworkDefinition parse(String name, Map<String, Object> fields) {
        return new FrameworkDefinition.Builder(name)
                .withVersion(string(fields.get("version")))
                .withAdapter(string(fields.get("module")))
                .withSetupArgs(string(fields.get("setup_args")))
                .withSetupCmd(string(fields.get("setup_cmd")))
                .withParams(asMap(name, fields.get("params")))
                .withProject(string(fields.get("project")))
                .withParent(string(fields.get("extends")))
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(String name, Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Framework " + name + ": expected a mapping, got " + value);
        }
        return (Map<String, Object>) value;
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }
}
