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

package io.github.amlbench.resources;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestResourceEstimator extends RandomizedTest {
    @Test
    public void testCoresNeverExceedRequestOrSystem() {
        for (int i = 0; i < 200; i++) {
            int system = randomIntBetween(1, 256);
            int requested = randomIntBetween(-4, 512);
            int resolved = ResourceEstimator.resolveCores(requested, system);
            if (requested > 0) {
                assertTrue(resolved <= Math.min(requested, system));
            } else {
                assertEquals(system, resolved);
            }
        }
    }

    @Test
    public void testRequestedMemoryWins() {
        assertEquals(1024, ResourceEstimator.resolveMemory(1024, new MemoryInfo(16384, 512), 2048));
    }

    @Test
    public void testUnspecifiedMemoryLeavesHalfTheHeadroom() {
        assertEquals(7168, ResourceEstimator.resolveMemory(0, new MemoryInfo(16384, 8192), 2048));
        assertEquals(7167, ResourceEstimator.resolveMemory(-1, new MemoryInfo(16384, 8192), 2049));
    }

    @Test
    public void testUnspecifiedMemoryFallsBackToAvailable() {
        assertEquals(512, ResourceEstimator.resolveMemory(0, new MemoryInfo(16384, 512), 2048));
    }

    @Test
    public void testAdvisoryPrecedence() {
        MemoryInfo mem = new MemoryInfo(16384, 8192);
        assertEquals(ResourceAdvisory.EXCEEDS_AVAILABLE_MEMORY, ResourceEstimator.advise(15000, mem, 2048));
        assertEquals(null, ResourceEstimator.advise(8192, mem, 2048));

        MemoryInfo tight = new MemoryInfo(4096, 4000);
        assertEquals(ResourceAdvisory.WITHIN_OS_BUFFER, ResourceEstimator.advise(3000, tight, 2048));
    }

    @Test
    public void testEstimateReadsLiveFigures() {
        var estimator = new ResourceEstimator(SystemResources.fixed(8, 16384, 8192), 2048);
        ResourceBudget budget = estimator.estimate("iris", 4, -1);
        assertEquals(4, budget.cores());
        assertEquals(7168, budget.memoryMb());
        assertEquals(8, budget.systemCores());
        assertFalse(budget.advisory().isPresent());

        ResourceBudget greedy = estimator.estimate("iris", 0, 10000);
        assertEquals(8, greedy.cores());
        assertEquals(ResourceAdvisory.EXCEEDS_AVAILABLE_MEMORY, greedy.advisory().get());
    }

    @Test
    public void testLocalResourcesAreSane() {
        SystemResources local = SystemResources.local();
        assertTrue(local.cores() > 0);
        assertTrue(local.memory().totalMb() > 0);
    }
}
