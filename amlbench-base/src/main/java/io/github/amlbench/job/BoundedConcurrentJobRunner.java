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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs jobs on a fixed pool of worker threads, so that at most {@code parallelJobs} of them run at
 * once.
 * <p>
 * Submissions are spaced by {@code startDelay} so that frameworks do not all start loading data
 * and allocating memory at the same instant. Completions are collected either by polling as they
 * arrive ({@code drainAsync}), in which case their order is arbitrary, or by joining each job in
 * submission order.
 * <p>
 * Running jobs are never cancelled: a hung framework call holds its worker until it returns.
 */
public class BoundedConcurrentJobRunner implements JobRunner {
    private static final Logger logger = LoggerFactory.getLogger(BoundedConcurrentJobRunner.class);
    private static final AtomicInteger threadCounter = new AtomicInteger(0);

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private final int parallelJobs;
    private final Duration startDelay;
    private final boolean drainAsync;
    private final Duration pollInterval;

    public BoundedConcurrentJobRunner(int parallelJobs, Duration startDelay, boolean drainAsync) {
        this(parallelJobs, startDelay, drainAsync, DEFAULT_POLL_INTERVAL);
    }

    public BoundedConcurrentJobRunner(int parallelJobs, Duration startDelay, boolean drainAsync, Duration pollInterval) {
        if (parallelJobs <= 0) {
            throw new IllegalArgumentException("parallelJobs must be positive, got " + parallelJobs);
        }
        this.parallelJobs = parallelJobs;
        this.startDelay = startDelay == null ? Duration.ZERO : startDelay;
        this.drainAsync = drainAsync;
        this.pollInterval = pollInterval;
    }

    public int getParallelJobs() {
        return parallelJobs;
    }

    @Override
    public List<JobCompletion> run(List<Job> jobs) {
        if (jobs.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(parallelJobs, jobs.size());
        logger.info("Running {} jobs on {} workers.", jobs.size(), workers);

        ExecutorService executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r);
            t.setName("JobRunner-Worker-" + threadCounter.getAndIncrement());
            t.setDaemon(false);
            return t;
        });
        CompletionService<JobCompletion> completionService = new ExecutorCompletionService<>(executor);
        Map<Future<JobCompletion>, Job> submitted = new LinkedHashMap<>();
        List<JobCompletion> completions = new ArrayList<>(jobs.size());
        try {
            for (int i = 0; i < jobs.size(); i++) {
                if (i > 0 && !startDelay.isZero()) {
                    Thread.sleep(startDelay.toMillis());
                }
                Job job = jobs.get(i);
                submitted.put(completionService.submit(job::run), job);
            }

            if (drainAsync) {
                Map<Future<JobCompletion>, Job> pending = new IdentityHashMap<>(submitted);
                while (!pending.isEmpty()) {
                    Future<JobCompletion> done = completionService.poll();
                    if (done == null) {
                        Thread.sleep(pollInterval.toMillis());
                        continue;
                    }
                    completions.add(collect(done, pending.remove(done)));
                }
            } else {
                for (Map.Entry<Future<JobCompletion>, Job> e : submitted.entrySet()) {
                    completions.add(collect(e.getKey(), e.getValue()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + (jobs.size() - completions.size()) + " jobs", e);
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                    logger.warn("Workers still busy 60s after the last completion.");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return completions;
    }

    /**
     * Waits for a submitted job. {@link Job#run()} handles exceptions itself, so an
     * {@link ExecutionException} here means an Error escaped the job; it is recorded in a
     * completion without result.
     */
    private static JobCompletion collect(Future<JobCompletion> future, Job job) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            logger.error("Job {} aborted.", job.getName(), e.getCause());
            return new JobCompletion(job, Double.NaN, null, e.getCause());
        }
    }
}
