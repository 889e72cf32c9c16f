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

import io.github.amlbench.benchmark.TaskConfig;
import io.github.amlbench.data.Dataset;

/**
 * Trains and evaluates one machine-learning framework on one task fold.
 * <p>
 * Adapters are registered once in a {@link FrameworkRegistry} under their framework name.
 * Any exception thrown by {@link #run} is isolated to the job that triggered it.
 */
public interface FrameworkAdapter {
    /**
     * Fits the framework on the training split and predicts the test split, within the budget
     * described by the task config. Enforcing {@link TaskConfig#getMaxRuntimeSeconds()} is up to
     * the adapter.
     */
    MetaResult run(Dataset dataset, TaskConfig config) throws Exception;

    /**
     * Installs whatever the framework needs. Called at most once per setup, before any run.
     *
     * @param setupArgs free-form arguments from the framework definition
     */
    default void setup(String setupArgs) throws Exception {
    }
}
