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

/**
 * A framework resolved from the registry: its effective definition and the adapter running it.
 */
public final class Framework {
    private final FrameworkDefinition definition;
    private final FrameworkAdapter adapter;
    private final Path directory;

    Framework(FrameworkDefinition definition, FrameworkAdapter adapter, Path directory) {
        this.definition = definition;
        this.adapter = adapter;
        this.directory = directory;
    }

    public String getName() {
        return definition.getName();
    }

    public FrameworkDefinition getDefinition() {
        return definition;
    }

    public FrameworkAdapter getAdapter() {
        return adapter;
    }

    /** Working directory of the framework, holding its setup marker. */
    public Path getDirectory() {
        return directory;
    }

    @Override
    public String toString() {
        return getName();
    }
}
