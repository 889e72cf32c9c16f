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

import io.github.amlbench.job.JobCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns the completions of a batch of jobs into a {@link Scoreboard}, and persists it.
 * <p>
 * Completions without result (jobs that failed before their framework ran) are left out; failed
 * framework runs show up as {@link NoResult} rows.
 */
public class ResultCollector {
    private static final Logger logger = LoggerFactory.getLogger(ResultCollector.class);

    private final String benchmarkName;
    private final ScoreboardStore runStore;
    private final ScoreboardStore allTimeStore;
    private final boolean saveResults;

    /**
     * @param runStore store of the current run, receiving each board under its own scope
     * @param allTimeStore cumulative store, receiving every board of every run
     * @param saveResults whether {@link #collect} persists the boards it builds
     */
    public ResultCollector(String benchmarkName, ScoreboardStore runStore, ScoreboardStore allTimeStore, boolean saveResults) {
        this.benchmarkName = benchmarkName;
        this.runStore = runStore;
        this.allTimeStore = allTimeStore;
        this.saveResults = saveResults;
    }

    /**
     * Builds the scoreboard of the given completions, bound to the task if one is given, to the
     * benchmark otherwise.
     *
     * @param taskName task the completions belong to, or null for a whole-benchmark board
     * @return the board, or empty when no completion carries a result
     * @throws UncheckedIOException if saving is enabled and a store cannot be written
     */
    public Optional<Scoreboard> collect(List<JobCompletion> completions, String frameworkName, String taskName) {
        List<Result> results = completions.stream()
                .map(JobCompletion::getResult)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        if (results.isEmpty()) {
            logger.warn("No results to collect for {} out of {} jobs.",
                    taskName == null ? benchmarkName : taskName, completions.size());
            return Optional.empty();
        }

        Scoreboard board = taskName == null
                ? Scoreboard.forBenchmark(results, frameworkName, benchmarkName)
                : Scoreboard.forTask(results, frameworkName, taskName);
        if (saveResults) {
            try {
                persist(board);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        logger.info("Summing up scores for {}:\n{}", board.scope(), board.asPrintableTable());
        return Optional.of(board);
    }

    /**
     * Appends the board to the run store and to the all-time store. Both stores are written even
     * if the first one fails; the first failure is rethrown with the second one suppressed.
     */
    public void persist(Scoreboard board) throws IOException {
        IOException failure = null;
        try {
            runStore.append(board);
        } catch (IOException e) {
            logger.error("Could not save {} to the run store.", board.scope(), e);
            failure = e;
        }
        try {
            allTimeStore.append(board);
        } catch (IOException e) {
            logger.error("Could not merge {} into the all-time store.", board.scope(), e);
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
