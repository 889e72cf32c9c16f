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

public class UnknownTaskException extends BenchmarkConfigurationException {
    private final String taskName;

    public UnknownTaskException(String taskName) {
        super("Incorrect task name: " + taskName + ".");
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }
}
