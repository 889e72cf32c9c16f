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

package io.github.amlbench.task;

/**
 * Raised when a benchmark invocation is misconfigured: unknown or disabled tasks, malformed or
 * out-of-range folds, unknown frameworks, or an empty task selection. These abort the whole
 * invocation before any job runs and are never retried.
 */
public class BenchmarkConfigurationException extends IllegalArgumentException {
    public BenchmarkConfigurationException(String message) {
        super(message);
    }
}
