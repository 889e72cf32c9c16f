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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scoreboard store kept in memory, keyed by {@link Scoreboard#scope()}.
 */
public class InMemoryScoreboardStore implements ScoreboardStore {
    private final Map<String, Scoreboard> boards = new LinkedHashMap<>();

    @Override
    public synchronized void append(Scoreboard board) {
        boards.merge(board.scope(), board, Scoreboard::append);
    }

    /** Every row stored so far, scope by scope. */
    public synchronized List<Result> rows() {
        List<Result> all = new ArrayList<>();
        boards.values().forEach(b -> all.addAll(b.rows()));
        return all;
    }

    /** The accumulated board of a scope, or null. */
    public synchronized Scoreboard get(String scope) {
        return boards.get(scope);
    }
}
