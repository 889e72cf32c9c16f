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

package io.github.amlbench.benchmark;

import io.github.amlbench.framework.Framework;
import io.github.amlbench.framework.FrameworkSetup;
import io.github.amlbench.framework.SetupMode;
import io.github.amlbench.job.Job;
import io.github.amlbench.job.JobCompletion;
import io.github.amlbench.job.JobRunner;
import io.github.amlbench.results.Result;
import io.github.amlbench.results.ResultCollector;
import io.github.amlbench.results.Scoreboard;
import io.github.amlbench.results.ScoreboardStore;
import io.github.amlbench.task.FoldSelection;
import io.github.amlbench.task.NoTaskAvailableException;
import io.github.amlbench.task.TaskCatalog;
import io.github.amlbench.task.TaskDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs one framework against the tasks of one benchmark.
 * <p>
 * Each call to {@link #run} selects tasks from the catalog, expands them into jobs (one per
 * fold), hands the jobs to the {@link JobRunner} and collects the completions into a scoreboard.
 * Configuration errors (unknown or disabled task, bad folds, empty selection) are raised before
 * any job runs. Failures of individual jobs never abort the run.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * Benchmark benchmark = Benchmark.create(catalog, registry.resolve("constantpredictor"), context,
 *         runStore, allTimeStore);
 * benchmark.setup(SetupMode.AUTO);
 *
 * // every enabled task, every fold
 * Optional<Scoreboard> all = benchmark.run();
 *
 * // folds 0 and 1 of iris
 * Optional<Scoreboard> iris = benchmark.run("iris", FoldSelection.of(List.of(0, 1)));
 * }</pre>
 */
public class Benchmark {
    private static final Logger logger = LoggerFactory.getLogger(Benchmark.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private final TaskCatalog catalog;
    private final Framework framework;
    private final JobFactory jobFactory;
    private final JobRunner runner;
    private final ResultCollector collector;
    private final String uid;

    public Benchmark(TaskCatalog catalog, Framework framework, BenchmarkContext context,
                     JobRunner runner, ResultCollector collector) {
        this(newUid(framework.getName(), catalog.getBenchmarkName()), catalog, framework, context, runner, collector);
    }

    public Benchmark(String uid, TaskCatalog catalog, Framework framework, BenchmarkContext context,
                     JobRunner runner, ResultCollector collector) {
        this.uid = uid;
        this.catalog = catalog;
        this.framework = framework;
        this.jobFactory = new JobFactory(context, new TaskExecutor(context));
        this.runner = runner;
        this.collector = collector;
    }

    /** A fresh uid: {@code <framework>-<benchmark>-<timestamp>}, lower-cased. */
    public static String newUid(String frameworkName, String benchmarkName) {
        return String.join("-", frameworkName, benchmarkName, LocalDateTime.now().format(TIMESTAMP))
                .toLowerCase(Locale.ROOT);
    }

    /**
     * A benchmark scheduling its jobs as the settings say, saving results to the given stores when
     * the settings enable it.
     */
    public static Benchmark create(TaskCatalog catalog, Framework framework, BenchmarkContext context,
                                   ScoreboardStore runStore, ScoreboardStore allTimeStore) {
        return create(newUid(framework.getName(), catalog.getBenchmarkName()), catalog, framework, context,
                runStore, allTimeStore);
    }

    public static Benchmark create(String uid, TaskCatalog catalog, Framework framework, BenchmarkContext context,
                                   ScoreboardStore runStore, ScoreboardStore allTimeStore) {
        BenchmarkSettings settings = context.getSettings();
        ResultCollector collector = new ResultCollector(catalog.getBenchmarkName(), runStore, allTimeStore,
                settings.isSaveResults());
        return new Benchmark(uid, catalog, framework, context, JobRunner.forSettings(settings), collector);
    }

    /** Identifier of this benchmark instance, see {@link #newUid}. */
    public String getUid() {
        return uid;
    }

    public Framework getFramework() {
        return framework;
    }

    /**
     * Sets up the framework according to the mode. With {@link SetupMode#ONLY} the caller is
     * expected to stop there.
     *
     * @return true if setup was performed
     */
    public boolean setup(SetupMode mode) throws IOException {
        return new FrameworkSetup().setup(framework, mode);
    }

    /** Runs all folds of every enabled task. */
    public Optional<Scoreboard> run() {
        return run(List.of(), FoldSelection.all());
    }

    public Optional<Scoreboard> run(String taskName, FoldSelection folds) {
        return run(List.of(taskName), folds);
    }

    /**
     * Runs the selected folds of the named tasks, or of every enabled task if no name is given.
     * <p>
     * When tasks are named, one scoreboard per task is built and persisted; the returned board
     * merges them under the benchmark's scope. Otherwise a single benchmark board is built.
     *
     * @return the scoreboard, or empty if no job produced a result
     * @throws io.github.amlbench.task.BenchmarkConfigurationException before any job runs
     */
    public Optional<Scoreboard> run(List<String> taskNames, FoldSelection folds) {
        try {
            boolean namedTasks = !taskNames.isEmpty();
            List<TaskDefinition> tasks = namedTasks ? catalog.get(taskNames) : catalog.listEnabled();
            if (tasks.isEmpty()) {
                throw new NoTaskAvailableException(catalog.getBenchmarkName());
            }
            List<Job> jobs = jobFactory.expand(tasks, folds, framework);
            logger.info("Running benchmark {}: {} jobs over {} tasks.", uid, jobs.size(), tasks.size());

            List<JobCompletion> completions = JobRunner.reconcileDurations(runner.run(jobs));
            if (!namedTasks) {
                return collector.collect(completions, framework.getName(), null);
            }

            List<Result> rows = new ArrayList<>();
            for (TaskDefinition task : tasks) {
                List<JobCompletion> ofTask = completions.stream()
                        .filter(c -> c.getJob().getTaskName().equals(task.getName()))
                        .collect(Collectors.toList());
                collector.collect(ofTask, framework.getName(), task.getName())
                        .ifPresent(board -> rows.addAll(board.rows()));
            }
            return rows.isEmpty()
                    ? Optional.empty()
                    : Optional.of(Scoreboard.forBenchmark(rows, framework.getName(), catalog.getBenchmarkName()));
        } finally {
            cleanup();
        }
    }

    /**
     * Called after every run, whatever its outcome.
     */
    protected void cleanup() {
        logger.debug("Benchmark {} cleaned up.", uid);
    }
}
