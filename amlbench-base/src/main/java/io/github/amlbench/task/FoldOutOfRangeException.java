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

public class FoldOutOfRangeException extends BenchmarkConfigurationException {
    private final int fold;

    public FoldOutOfRangeException(int fold, TaskDefinition task) {
        super("Fold value " + fold + " is out of range for task " + task.getName()
                + " (expected 0.." + (task.getFolds() - 1) + ").");
        this.fold = fold;
    }

    public int getFold() {
        return fold;
    }
}
