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

import java.util.Optional;

/**
 * A finished job: its measured wall-clock duration and its result. The result is absent only when
 * the job failed before its framework could run, in which case {@link #getFailure()} tells why.
 */
public final class JobCompletion {
    private final Job job;
    private final double durationSeconds;
    private final Result result;
    private final Throwable failure;

    public JobCompletion(Job job, double durationSeconds, Result result, Throwable failure) {
        this.job = job;
        this.durationSeconds = durationSeconds;
        this.result = result;
        this.failure = failure;
    }

    public Job getJob() {
        return job;
    }

    /** Wall-clock duration measured by the runner, in seconds; NaN if the job never reported. */
    public double getDurationSeconds() {
        return durationSeconds;
    }

    public Optional<Result> getResult() {
        return Optional.ofNullable(result);
    }

    public Throwable getFailure() {
        return failure;
    }

    /**
     * If the result reports no duration (NaN), returns a completion whose result carries the
     * runner-measured duration instead. Otherwise returns this completion.
     */
    public JobCompletion reconcileDuration() {
        if (result == null || !Double.isNaN(result.getDuration())) {
            return this;
        }
        return new JobCompletion(job, durationSeconds, result.withDuration(durationSeconds), failure);
    }

    @Override
    public String toString() {
        return "JobCompletion{" + job.getName() + ", duration=" + durationSeconds
                + (result == null ? ", failure=" + failure : ", result=" + result) + '}';
    }
}
