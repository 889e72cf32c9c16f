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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.amlbench.TestUtil;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestFoldSelection extends RandomizedTest {
    @Test
    public void testAllFoldsCoverEachFoldOnce() {
        for (int i = 0; i < 20; i++) {
            int k = randomIntBetween(1, 50);
            List<Integer> folds = FoldSelection.all().resolve(TestUtil.iris(k));
            assertEquals(k, folds.size());
            assertEquals(k, new HashSet<>(folds).size());
            for (int f : folds) {
                assertTrue(f >= 0 && f < k);
            }
        }
    }

    @Test
    public void testListResolvesIffAllFoldsInRange() {
        for (int i = 0; i < 50; i++) {
            int k = randomIntBetween(1, 10);
            List<Integer> requested = new ArrayList<>();
            int n = randomIntBetween(1, 5);
            for (int j = 0; j < n; j++) {
                requested.add(randomIntBetween(-2, 12));
            }
            boolean valid = requested.stream().allMatch(f -> f >= 0 && f < k);
            FoldSelection selection = FoldSelection.of(requested);
            if (valid) {
                assertEquals(new ArrayList<>(new LinkedHashSet<>(requested)), selection.resolve(TestUtil.iris(k)));
            } else {
                assertThrows(FoldOutOfRangeException.class, () -> selection.resolve(TestUtil.iris(k)));
            }
        }
    }

    @Test
    public void testOutOfRangeReportsFold() {
        var e = assertThrows(FoldOutOfRangeException.class, () -> FoldSelection.of(2).resolve(TestUtil.iris(2)));
        assertEquals(2, e.getFold());
    }

    @Test
    public void testFromAcceptedShapes() {
        assertTrue(FoldSelection.from(null).isAll());
        assertEquals(List.of(1), FoldSelection.from(1).resolve(TestUtil.iris(2)));
        assertEquals(List.of(0, 1), FoldSelection.from(List.of(0, 1)).resolve(TestUtil.iris(2)));
    }

    @Test
    public void testRepeatedFoldsKeptOnce() {
        assertEquals(List.of(1, 0), FoldSelection.of(List.of(1, 0, 1, 1)).resolve(TestUtil.iris(2)));
        assertEquals(List.of(0), FoldSelection.from(List.of(0, 0)).resolve(TestUtil.iris(2)));
    }

    @Test
    public void testFromRejectsOtherShapes() {
        assertThrows(InvalidFoldSpecException.class, () -> FoldSelection.from("1"));
        assertThrows(InvalidFoldSpecException.class, () -> FoldSelection.from(List.of(0, "1")));
        assertThrows(InvalidFoldSpecException.class, () -> FoldSelection.from(Set.of(0)));
    }
}
