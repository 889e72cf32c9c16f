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

package io.github.amlbench.results;

import io.github.amlbench.TestUtil;
import io.github.amlbench.job.Job;
import io.github.amlbench.job.JobCompletion;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestResultCollector {
    private Path testDirectory;

    @Before
    public void setup() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
    }

    @After
    public void tearDown() {
        TestUtil.deleteQuietly(testDirectory);
    }

    private JobCompletion completed(int fold) {
        Job job = new Job("local", "iris", fold, TestUtil.CONSTANT, () -> TestUtil.scoredResult(fold, testDirectory));
        return job.run();
    }

    private JobCompletion failed(int fold) {
        Job job = new Job("local", "iris", fold, TestUtil.CONSTANT, () -> {
            throw new IOException("cannot load");
        });
        return job.run();
    }

    @Test
    public void testEmptyWhenNoResult() {
        var runStore = new InMemoryScoreboardStore();
        var collector = new ResultCollector("test", runStore, ScoreboardStore.discarding(), true);
        assertFalse(collector.collect(List.of(failed(0)), TestUtil.CONSTANT, null).isPresent());
        assertTrue(runStore.rows().isEmpty());
    }

    @Test
    public void testCompletionsWithoutResultAreLeftOut() {
        var collector = new ResultCollector("test", ScoreboardStore.discarding(), ScoreboardStore.discarding(), false);
        Optional<Scoreboard> board = collector.collect(List.of(completed(0), failed(1), completed(2)), TestUtil.CONSTANT, null);
        assertEquals(2, board.get().size());
    }

    @Test
    public void testBoardScope() {
        var collector = new ResultCollector("test", ScoreboardStore.discarding(), ScoreboardStore.discarding(), false);
        Scoreboard benchmark = collector.collect(List.of(completed(0)), TestUtil.CONSTANT, null).get();
        assertFalse(benchmark.isTaskScoped());
        assertEquals("test", benchmark.getBenchmarkName());
        assertNull(benchmark.getTaskName());
        assertEquals("benchmark_test", benchmark.scope());

        Scoreboard task = collector.collect(List.of(completed(0)), TestUtil.CONSTANT, "iris").get();
        assertTrue(task.isTaskScoped());
        assertNull(task.getBenchmarkName());
        assertEquals("task_iris", task.scope());
    }

    @Test
    public void testSavesToBothStores() {
        var runStore = new InMemoryScoreboardStore();
        var allTime = new InMemoryScoreboardStore();
        var collector = new ResultCollector("test", runStore, allTime, true);
        collector.collect(List.of(completed(0), completed(1)), TestUtil.CONSTANT, "iris");
        collector.collect(List.of(completed(2)), TestUtil.CONSTANT, "iris");

        assertEquals(3, runStore.get("task_iris").size());
        assertEquals(3, allTime.rows().size());
    }

    @Test
    public void testNothingSavedWhenDisabled() {
        var runStore = new InMemoryScoreboardStore();
        new ResultCollector("test", runStore, runStore, false).collect(List.of(completed(0)), TestUtil.CONSTANT, null);
        assertTrue(runStore.rows().isEmpty());
    }

    @Test
    public void testStoresAreSavedIndependently() {
        var allTime = new InMemoryScoreboardStore();
        ScoreboardStore broken = board -> {
            throw new IOException("disk full");
        };
        var collector = new ResultCollector("test", broken, allTime, true);
        Scoreboard board = Scoreboard.forTask(List.of(TestUtil.scoredResult(0, testDirectory)), TestUtil.CONSTANT, "iris");

        var e = assertThrows(IOException.class, () -> collector.persist(board));
        assertEquals("disk full", e.getMessage());
        assertEquals(1, allTime.rows().size());
    }

    @Test
    public void testCombiningStoreWritesAllAndRethrows() {
        var first = new InMemoryScoreboardStore();
        var last = new InMemoryScoreboardStore();
        ScoreboardStore combined = ScoreboardStore.combining(first, board -> {
            throw new IOException("broken");
        }, last);
        Scoreboard board = Scoreboard.forTask(List.of(TestUtil.scoredResult(0, testDirectory)), TestUtil.CONSTANT, "iris");
        assertThrows(IOException.class, () -> combined.append(board));
        assertEquals(1, first.rows().size());
        assertEquals(1, last.rows().size());
    }
}
