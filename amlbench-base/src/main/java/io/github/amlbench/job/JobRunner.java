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

import io.github.amlbench.benchmark.BenchmarkSettings;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Strategy driving a batch of jobs to completion.
 * <p>
 * Every implementation returns exactly one completion per submitted job, runs each job at most
 * once, and keeps the failure of one job from affecting the others. Completion order is only
 * guaranteed by {@link SequentialJobRunner}.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * // one job at a time, in submission order
 * JobRunner runner = JobRunner.sequential();
 *
 * // up to 4 jobs at once, submissions 5s apart, collecting completions as they arrive
 * JobRunner runner = JobRunner.boundedConcurrent(4, Duration.ofSeconds(5), true);
 *
 * List<JobCompletion> completions = runner.run(jobs);
 * }</pre>
 */
@FunctionalInterface
public interface JobRunner {
    List<JobCompletion> run(List<Job> jobs);

    static JobRunner sequential() {
        return new SequentialJobRunner();
    }

    /**
     * @param parallelJobs maximum number of jobs running at once
     * @param startDelay pause between two submissions
     * @param drainAsync poll for completions as they arrive rather than joining in submission order
     */
    static JobRunner boundedConcurrent(int parallelJobs, Duration startDelay, boolean drainAsync) {
        return new BoundedConcurrentJobRunner(parallelJobs, startDelay, drainAsync);
    }

    /**
     * Sequential runner for one parallel job, bounded-concurrency runner otherwise.
     */
    static JobRunner forSettings(BenchmarkSettings settings) {
        if (settings.getParallelJobs() <= 1) {
            return sequential();
        }
        return boundedConcurrent(settings.getParallelJobs(), settings.getJobStartDelay(), settings.isDrainAsync());
    }

    /** Applies {@link JobCompletion#reconcileDuration()} to each completion, keeping the order. */
    static List<JobCompletion> reconcileDurations(List<JobCompletion> completions) {
        return completions.stream()
                .map(JobCompletion::reconcileDuration)
                .collect(Collectors.toList());
    }
}
