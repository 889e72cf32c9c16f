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

package io.github.amlbench.job;

import io.github.amlbench.results.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One (task, fold, framework) unit of work, identified by its runner scope, task name, fold and
 * framework name. The deferred work runs exactly once, through {@link #run()}.
 * <p>
 * {@link #run()} never throws: an exception escaping the work (e.g. a dataset that cannot be
 * loaded) is logged and recorded in the completion, which then carries no result.
 */
public final class Job {
    private static final Logger logger = LoggerFactory.getLogger(Job.class);

    private final String scope;
    private final String taskName;
    private final int fold;
    private final String frameworkName;
    private final Callable<Result> work;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public Job(String scope, String taskName, int fold, String frameworkName, Callable<Result> work) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.taskName = Objects.requireNonNull(taskName, "taskName");
        this.fold = fold;
        this.frameworkName = Objects.requireNonNull(frameworkName, "frameworkName");
        this.work = Objects.requireNonNull(work, "work");
    }

    public String getName() {
        return String.join("_", scope, taskName, Integer.toString(fold), frameworkName);
    }

    public String getScope() {
        return scope;
    }

    public String getTaskName() {
        return taskName;
    }

    public int getFold() {
        return fold;
    }

    public String getFrameworkName() {
        return frameworkName;
    }

    /**
     * Runs the work and measures its wall-clock duration.
     *
     * @throws IllegalStateException if the job was already started
     */
    public JobCompletion run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Job " + getName() + " has already been started");
        }
        logger.info("Starting job {}.", getName());
        long start = System.nanoTime();
        Result result = null;
        Exception failure = null;
        try {
            result = work.call();
        } catch (Exception e) {
            logger.error("Job {} failed.", getName(), e);
            failure = e;
        }
        double duration = (System.nanoTime() - start) / 1_000_000_000.0;
        logger.info("Job {} completed in {}s.", getName(), String.format("%.3f", duration));
        return new JobCompletion(this, duration, result, failure);
    }

    public boolean isStarted() {
        return started.get();
    }

    @Override
    public String toString() {
        return getName();
    }
}
