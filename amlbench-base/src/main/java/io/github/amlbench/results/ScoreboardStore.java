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

import java.io.IOException;
import java.util.List;

/**
 * Strategy for persisting scoreboards.
 * <p>
 * A store accumulates: appending a board keeps whatever was stored before for the same scope.
 *
 * @see InMemoryScoreboardStore
 */
@FunctionalInterface
public interface ScoreboardStore {
    /**
     * Appends the rows of the board to the rows already stored for its scope.
     *
     * @throws IOException if the store cannot be written
     */
    void append(Scoreboard board) throws IOException;

    /**
     * A store that keeps nothing.
     */
    static ScoreboardStore discarding() {
        return board -> { };
    }

    /**
     * A store appending to each of the given stores in turn. Every store is written even if an
     * earlier one fails; the first failure is rethrown afterwards.
     */
    static ScoreboardStore combining(ScoreboardStore... stores) {
        List<ScoreboardStore> all = List.of(stores);
        return board -> {
            IOException failure = null;
            for (ScoreboardStore store : all) {
                try {
                    store.append(board);
                } catch (IOException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        };
    }
}
