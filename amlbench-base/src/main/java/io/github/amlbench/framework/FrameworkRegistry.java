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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lookup table of framework definitions and of the adapters implementing them, keyed by
 * case-insensitive name. Frameworks are resolved once at startup.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FrameworkRegistry registry = new FrameworkRegistry(Path.of("frameworks"))
 *     .registerAdapter("constantpredictor", new ConstantPredictor())
 *     .registerDefinitions(FrameworkDefinitions.loadDefault());
 * Framework framework = registry.resolve("constantpredictor_enc");
 * }</pre>
 */
public class FrameworkRegistry {
    private final Path frameworksDir;
    private final Map<String, FrameworkDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, FrameworkAdapter> adapters = new LinkedHashMap<>();

    /**
     * @param frameworksDir root under which each adapter gets its own working directory
     */
    public FrameworkRegistry(Path frameworksDir) {
        this.frameworksDir = frameworksDir;
    }

    public FrameworkRegistry registerAdapter(String adapterName, FrameworkAdapter adapter) {
        adapters.put(key(adapterName), adapter);
        return this;
    }

    public FrameworkRegistry registerDefinition(FrameworkDefinition definition) {
        definitions.put(key(definition.getName()), definition);
        return this;
    }

    public FrameworkRegistry registerDefinitions(List<FrameworkDefinition> defs) {
        defs.forEach(this::registerDefinition);
        return this;
    }

    /**
     * Shortcut registering an adapter together with a bare definition of the same name.
     */
    public FrameworkRegistry register(FrameworkDefinition definition, FrameworkAdapter adapter) {
        registerDefinition(definition);
        return registerAdapter(definition.getAdapter(), adapter);
    }

    /** Registered definitions, in registration order. */
    public List<FrameworkDefinition> definitions() {
        return new ArrayList<>(definitions.values());
    }

    /**
     * Resolves the definition of a framework, following its {@code extends} chain, and binds it
     * to its adapter.
     *
     * @throws UnknownFrameworkException if the definition, a parent, or the adapter is missing,
     *                                   or if the inheritance chain loops
     */
    public Framework resolve(String name) {
        FrameworkDefinition def = resolveDefinition(name, new LinkedHashSet<>());
        FrameworkAdapter adapter = adapters.get(key(def.getAdapter()));
        if (adapter == null) {
            throw new UnknownFrameworkException(name, "no adapter registered under '" + def.getAdapter() + "'");
        }
        return new Framework(def, adapter, frameworksDir.resolve(def.getAdapter()));
    }

    private FrameworkDefinition resolveDefinition(String name, Set<String> visiting) {
        if (!visiting.add(key(name))) {
            throw new UnknownFrameworkException(name, "circular extends chain " + visiting);
        }
        FrameworkDefinition def = definitions.get(key(name));
        if (def == null) {
            throw new UnknownFrameworkException(name, "no definition found");
        }
        if (def.getParent() == null) {
            return def;
        }
        return def.extend(resolveDefinition(def.getParent(), visiting));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
