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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of a framework, as found in a frameworks file: its version, the
 * parameters passed to every run, and how to set it up.
 * <p>
 * A definition may extend another one; {@link #extend(FrameworkDefinition)} resolves the
 * inheritance, with the child's values winning and parameter maps merged key by key.
 */
public final class FrameworkDefinition {
    private final String name;
    private final String version;
    private final String adapter;
    private final String setupArgs;
    private final String setupCmd;
    private final Map<String, Object> params;
    private final String project;
    private final String parent;

    private FrameworkDefinition(Builder builder) {
        this.name = builder.name;
        this.version = builder.version;
        this.adapter = builder.adapter;
        this.setupArgs = builder.setupArgs;
        this.setupCmd = builder.setupCmd;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.project = builder.project;
        this.parent = builder.parent;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    /** Name of the adapter implementing this framework; defaults to the framework name. */
    public String getAdapter() {
        return adapter == null ? name : adapter;
    }

    public String getSetupArgs() {
        return setupArgs;
    }

    /** Shell command run once at setup, or null. */
    public String getSetupCmd() {
        return setupCmd;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public String getProject() {
        return project;
    }

    /** Name of the definition this one extends, or null. */
    public String getParent() {
        return parent;
    }

    /**
     * Resolves inheritance from the given parent definition. The result no longer has a parent.
     */
    public FrameworkDefinition extend(FrameworkDefinition base) {
        Map<String, Object> merged = new LinkedHashMap<>(base.params);
        merged.putAll(params);
        return new Builder(name)
                .withVersion(version != null ? version : base.version)
                .withAdapter(adapter != null ? adapter : base.getAdapter())
                .withSetupArgs(setupArgs != null ? setupArgs : base.setupArgs)
                .withSetupCmd(setupCmd != null ? setupCmd : base.setupCmd)
                .withParams(merged)
                .withProject(project != null ? project : base.project)
                .withParent(base.parent)
                .build();
    }

    @Override
    public String toString() {
        return "FrameworkDefinition{" +
                "name='" + name + '\'' +
                ", version='" + version + '\'' +
                ", adapter='" + getAdapter() + '\'' +
                ", params=" + params +
                (parent == null ? "" : ", extends='" + parent + '\'') +
                '}';
    }

    public static class Builder {
        private final String name;
        private String version;
        private String adapter;
        private String setupArgs;
        private String setupCmd;
        private Map<String, Object> params = Map.of();
        private String project;
        private String parent;

        public Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder withVersion(String version) {
            this.version = version;
            return this;
        }

        public Builder withAdapter(String adapter) {
            this.adapter = adapter;
            return this;
        }

        public Builder withSetupArgs(String setupArgs) {
            this.setupArgs = setupArgs;
            return this;
        }

        public Builder withSetupCmd(String setupCmd) {
            this.setupCmd = setupCmd;
            return this;
        }

        public Builder withParams(Map<String, Object> params) {
            this.params = params == null ? Map.of() : params;
            return this;
        }

        public Builder withProject(String project) {
            this.project = project;
            return this;
        }

        public Builder withParent(String parent) {
            this.parent = parent;
            return this;
        }

        public FrameworkDefinition build() {
            return new FrameworkDefinition(this);
        }
    }
}
