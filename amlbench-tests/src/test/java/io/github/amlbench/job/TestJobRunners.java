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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.amlbench.TestUtil;
import io.github.amlbench.benchmark.BenchmarkSettings;
import io.github.amlbench.results.Result;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestJobRunners extends RandomizedTest {
    private Path testDirectory;

    @Before
    public void setup() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
    }

    @After
    public void tearDown() {
        TestUtil.deleteQuietly(testDirectory);
    }

    private Job job(int fold, Callable<Result> work) {
        return new Job("local", "iris", fold, "constant", work);
    }

    private List<Job> jobs(int count, AtomicInteger running, AtomicInteger maxRunning, int failingFold) {
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int fold = i;
            jobs.add(job(fold, () -> {
                int now = running.incrementAndGet();
                maxRunning.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(randomIntBetween(1, 20));
                    if (fold == failingFold) {
                        throw new IllegalStateException("job " + fold + " fails");
                    }
                    return TestUtil.scoredResult(fold, testDirectory);
                } finally {
                    running.decrementAndGet();
                }
            }));
        }
        return jobs;
    }

    @Test
    public void testJobName() {
        assertEquals("local_iris_3_constant", job(3, () -> null).getName());
    }

    @Test
    public void testSequentialKeepsOrderAndIsolatesFailures() {
        var running = new AtomicInteger();
        var maxRunning = new AtomicInteger();
        List<Job> jobs = jobs(3, running, maxRunning, 1);

        List<JobCompletion> completions = JobRunner.sequential().run(jobs);

        assertEquals(3, completions.size());
        assertEquals(1, maxRunning.get());
        for (int i = 0; i < 3; i++) {
            assertSame(jobs.get(i), completions.get(i).getJob());
        }
        assertTrue(completions.get(0).getResult().isPresent());
        assertFalse(completions.get(1).getResult().isPresent());
        assertTrue(completions.get(1).getFailure() instanceof IllegalStateException);
        assertTrue(completions.get(2).getResult().isPresent());
    }

    @Test
    public void testBoundedConcurrencyHonoursCap() {
        for (boolean drainAsync : new boolean[] {true, false}) {
            int parallel = randomIntBetween(1, 4);
            int count = randomIntBetween(1, 16);
            int failing = randomIntBetween(-1, count - 1);
            var running = new AtomicInteger();
            var maxRunning = new AtomicInteger();
            List<Job> jobs = jobs(count, running, maxRunning, failing);

            List<JobCompletion> completions = JobRunner.boundedConcurrent(parallel, Duration.ZERO, drainAsync).run(jobs);

            assertEquals(count, completions.size());
            assertTrue("max running " + maxRunning.get() + " > " + parallel, maxRunning.get() <= parallel);
            Set<Job> completed = completions.stream().map(JobCompletion::getJob).collect(Collectors.toSet());
            assertEquals(new HashSet<>(jobs), completed);
            long withResult = completions.stream().filter(c -> c.getResult().isPresent()).count();
            assertEquals(failing >= 0 ? count - 1 : count, withResult);
        }
    }

    @Test
    public void testBlockingJoinKeepsSubmissionOrder() {
        List<Job> jobs = jobs(6, new AtomicInteger(), new AtomicInteger(), -1);
        List<JobCompletion> completions = JobRunner.boundedConcurrent(3, Duration.ZERO, false).run(jobs);
        for (int i = 0; i < jobs.size(); i++) {
            assertSame(jobs.get(i), completions.get(i).getJob());
        }
    }

    @Test
    public void testStaggeredSubmissions() {
        List<Job> jobs = jobs(3, new AtomicInteger(), new AtomicInteger(), -1);
        long start = System.nanoTime();
        List<JobCompletion> completions = JobRunner.boundedConcurrent(3, Duration.ofMillis(50), true).run(jobs);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertEquals(3, completions.size());
        assertTrue("elapsed " + elapsedMs, elapsedMs >= 100);
    }

    @Test
    public void testEmptyBatch() {
        assertTrue(JobRunner.boundedConcurrent(2, Duration.ZERO, true).run(List.of()).isEmpty());
        assertTrue(JobRunner.sequential().run(List.of()).isEmpty());
    }

    @Test
    public void testJobRunsAtMostOnce() {
        var calls = new AtomicInteger();
        Job job = job(0, () -> {
            calls.incrementAndGet();
            return null;
        });
        assertFalse(job.isStarted());
        job.run();
        assertTrue(job.isStarted());
        assertThrows(IllegalStateException.class, job::run);
        assertEquals(1, calls.get());
    }

    @Test
    public void testErrorsEscapingAJobAreRecorded() {
        Job failing = job(0, () -> {
            throw new AssertionError("boom");
        });
        Job fine = job(1, () -> TestUtil.scoredResult(1, testDirectory));
        List<JobCompletion> completions = JobRunner.boundedConcurrent(2, Duration.ZERO, false).run(List.of(failing, fine));
        assertEquals(2, completions.size());
        assertFalse(completions.get(0).getResult().isPresent());
        assertTrue(completions.get(0).getFailure() instanceof AssertionError);
        assertTrue(completions.get(1).getResult().isPresent());
    }

    @Test
    public void testDurationReconciliation() {
        Job job = job(0, () -> TestUtil.scoredResult(0, testDirectory));
        JobCompletion completion = job.run();
        assertTrue(Double.isNaN(completion.getResult().get().getDuration()));

        JobCompletion reconciled = JobRunner.reconcileDurations(List.of(completion)).get(0);
        assertEquals(completion.getDurationSeconds(), reconciled.getResult().get().getDuration(), 0.0);

        JobCompletion measured = new JobCompletion(job, 42.0, reconciled.getResult().get(), null);
        assertEquals(completion.getDurationSeconds(), measured.reconcileDuration().getResult().get().getDuration(), 0.0);
    }

    @Test
    public void testReconciliationWithoutResult() {
        Job job = job(0, () -> null);
        JobCompletion completion = job.run();
        assertSame(completion, completion.reconcileDuration());
        assertNull(completion.getFailure());
    }

    @Test
    public void testRunnerForSettings() {
        BenchmarkSettings one = TestUtil.settings(testDirectory);
        assertTrue(JobRunner.forSettings(one) instanceof SequentialJobRunner);

        BenchmarkSettings four = one.toBuilder().withParallelJobs(4).build();
        JobRunner runner = JobRunner.forSettings(four);
        assertTrue(runner instanceof BoundedConcurrentJobRunner);
        assertEquals(4, ((BoundedConcurrentJobRunner) runner).getParallelJobs());
    }
}
