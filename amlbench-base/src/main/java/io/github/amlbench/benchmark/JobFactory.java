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

package io.github.amlbench.benchmark;

import io.github.amlbench.framework.Framework;
import io.github.amlbench.job.Job;
import io.github.amlbench.task.FoldSelection;
import io.github.amlbench.task.TaskDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands task definitions into jobs, one per selected fold.
 */
public class JobFactory {
    private final BenchmarkContext context;
    private final TaskExecutor executor;

    public JobFactory(BenchmarkContext context, TaskExecutor executor) {
        this.context = context;
        this.executor = executor;
    }

    /**
     * Creates the jobs running the framework on the selected folds of the task, in fold order
     * of the selection.
     *
     * @throws io.github.amlbench.task.FoldOutOfRangeException if any selected fold is outside
     *         the task's folds; no job is created then
     */
    public List<Job> expand(TaskDefinition task, FoldSelection folds, Framework framework) {
        List<Integer> resolved = folds.resolve(task);
        List<Job> jobs = new ArrayList<>(resolved.size());
        for (int fold : resolved) {
            TaskConfig template = TaskConfig.template(task, fold, context.getSettings());
            jobs.add(new Job(context.getMode(), task.getName(), fold, framework.getName(),
                    () -> executor.execute(task, template, framework)));
        }
        return jobs;
    }

    /** Expands every task in order, validating all of them before returning any job. */
    public List<Job> expand(List<TaskDefinition> tasks, FoldSelection folds, Framework framework) {
        List<Job> jobs = new ArrayList<>();
        for (TaskDefinition task : tasks) {
            jobs.addAll(expand(task, folds, framework));
        }
        return jobs;
    }
}
