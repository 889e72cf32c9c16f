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

package io.github.amlbench.example;

import io.github.amlbench.benchmark.Benchmark;
import io.github.amlbench.benchmark.BenchmarkContext;
import io.github.amlbench.benchmark.BenchmarkSettings;
import io.github.amlbench.example.frameworks.ConstantPredictor;
import io.github.amlbench.example.util.CsvDatasetService;
import io.github.amlbench.example.util.CsvScoreboardStore;
import io.github.amlbench.example.util.JsonScoreboardStore;
import io.github.amlbench.example.yaml.BenchmarkDefinitions;
import io.github.amlbench.example.yaml.FrameworkDefinitions;
import io.github.amlbench.example.yaml.RunConfig;
import io.github.amlbench.framework.Framework;
import io.github.amlbench.framework.FrameworkDefinition;
import io.github.amlbench.framework.FrameworkRegistry;
import io.github.amlbench.framework.SetupMode;
import io.github.amlbench.results.Scoreboard;
import io.github.amlbench.results.ScoreboardStore;
import io.github.amlbench.task.BenchmarkConfigurationException;
import io.github.amlbench.task.FoldSelection;
import io.github.amlbench.task.TaskCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line interface of the benchmark, using PicoCLI.
 *
 * <h2>Available Subcommands</h2>
 * <ul>
 *   <li>{@code run} - Run a framework against a benchmark</li>
 *   <li>{@code frameworks} - List the framework definitions</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 * <pre>
 * # Run the constant predictor on every task of the bundled test benchmark
 * java -jar amlbench.jar run constantpredictor test
 *
 * # Folds 0 and 1 of iris, 4 jobs at once, with a 60s budget per job
 * java -jar amlbench.jar run constantpredictor test -t iris -f 0 -f 1 -p 4 -X t.max_runtime_seconds=60
 *
 * # Only set up the framework
 * java -jar amlbench.jar run constantpredictor -s only
 * </pre>
 * Exit codes: 0 when results were produced, 1 when no job produced a result, 2 on configuration
 * errors (unknown framework, benchmark or task, bad folds, invalid options).
 */
@CommandLine.Command(
        name = "amlbench",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Benchmark of machine-learning frameworks on dataset folds",
        subcommands = {
                BenchmarkCLI.RunCommand.class,
                BenchmarkCLI.FrameworksCommand.class
        }
)
public class BenchmarkCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkCLI.class);

    static final int NO_RESULT = 1;
    static final int CONFIGURATION_ERROR = 2;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Registry of the frameworks defined in the configured (or bundled) frameworks file, with the
     * adapters shipped in this module.
     */
    static FrameworkRegistry registry(RunConfig config) throws IOException {
        List<FrameworkDefinition> definitions = config.getFrameworksFile() != null
                ? FrameworkDefinitions.load(config.getFrameworksFile())
                : FrameworkDefinitions.loadDefault();
        return new FrameworkRegistry(config.getFrameworksDir())
                .registerDefinitions(definitions)
                .registerAdapter(ConstantPredictor.NAME, new ConstantPredictor());
    }

    @CommandLine.Command(
            name = "run",
            description = "Run a framework against the tasks of a benchmark"
    )
    static class RunCommand implements Callable<Integer> {
        @CommandLine.Parameters(index = "0", description = "Framework to evaluate, as named in the frameworks file")
        String framework;

        @CommandLine.Parameters(index = "1", arity = "0..1", defaultValue = "test",
                description = "Benchmark name or definition file (default: ${DEFAULT-VALUE})")
        String benchmark;

        @CommandLine.Option(names = {"-t", "--task"}, description = "Task to run, repeatable. All enabled tasks if omitted.")
        List<String> tasks = new ArrayList<>();

        @CommandLine.Option(names = {"-f", "--fold"}, description = "Fold to run, repeatable. All folds if omitted.")
        List<Integer> folds = new ArrayList<>();

        @CommandLine.Option(names = {"-p", "--parallel"}, description = "Number of jobs running at once")
        Integer parallelJobs;

        @CommandLine.Option(names = {"-s", "--setup"}, defaultValue = "auto",
                description = "Framework setup: auto, skip, force or only (default: ${DEFAULT-VALUE})")
        String setupMode;

        @CommandLine.Option(names = {"-i", "--indir"}, description = "Input directory of the datasets")
        Path inputDir;

        @CommandLine.Option(names = {"-o", "--outdir"}, description = "Output directory of the results")
        Path outputDir;

        @CommandLine.Option(names = {"-c", "--config"}, description = "User config file merged over the defaults")
        Path userConfig;

        @CommandLine.Option(names = "-X", description = "Config override key=value; f.<param> and t.<field> override framework params and task fields")
        Map<String, String> overrides = new LinkedHashMap<>();

        @Override
        public Integer call() throws IOException {
            RunConfig config = RunConfig.load(userConfig).withOverrides(overrides);
            var builder = config.toSettings().toBuilder();
            if (inputDir != null) builder.withInputDir(inputDir);
            if (outputDir != null) builder.withOutputDir(outputDir);
            if (parallelJobs != null) builder.withParallelJobs(parallelJobs);
            BenchmarkSettings settings = builder.build();

            SetupMode mode = SetupMode.parse(setupMode);
            Framework fw = registry(config).resolve(framework);
            TaskCatalog catalog = BenchmarkDefinitions.load(benchmark, config.getBenchmarkDefinitionsDir());

            String uid = Benchmark.newUid(fw.getName(), catalog.getBenchmarkName());
            BenchmarkSettings runSettings = settings.toBuilder()
                    .withOutputDir(settings.getOutputDir().resolve(uid))
                    .build();
            logger.info("Running benchmark {} with settings {}.", uid, runSettings);

            BenchmarkContext context = BenchmarkContext.local(new CsvDatasetService(runSettings.getInputDir()), runSettings);
            ScoreboardStore runStore = ScoreboardStore.combining(
                    CsvScoreboardStore.perScope(runSettings.getScoresDir()),
                    new JsonScoreboardStore(runSettings.getScoresDir()));
            ScoreboardStore allTimeStore = CsvScoreboardStore.singleFile(settings.getOutputDir().resolve("results.csv"));
            Benchmark bench = Benchmark.create(uid, catalog, fw, context, runStore, allTimeStore);

            bench.setup(mode);
            if (mode == SetupMode.ONLY) {
                logger.info("Setup of framework {} complete, no task run.", fw.getName());
                return 0;
            }

            FoldSelection selection = folds.isEmpty() ? FoldSelection.all() : FoldSelection.of(folds);
            Optional<Scoreboard> board = bench.run(tasks, selection);
            return board.isPresent() ? 0 : NO_RESULT;
        }
    }

    @CommandLine.Command(
            name = "frameworks",
            description = "List the framework definitions"
    )
    static class FrameworksCommand implements Callable<Integer> {
        @CommandLine.Option(names = {"-c", "--config"}, description = "User config file merged over the defaults")
        Path userConfig;

        @Override
        public Integer call() throws IOException {
            FrameworkRegistry registry = registry(RunConfig.load(userConfig));
            for (FrameworkDefinition def : registry.definitions()) {
                String line;
                try {
                    Framework fw = registry.resolve(def.getName());
                    line = String.format("%-30s %-12s params=%s", fw.getName(),
                            fw.getDefinition().getVersion(), fw.getDefinition().getParams());
                } catch (BenchmarkConfigurationException e) {
                    line = String.format("%-30s %s", def.getName(), e.getMessage());
                }
                System.out.println(line);
            }
            return 0;
        }
    }

    /**
     * Entry point. Configuration errors, {@link BenchmarkConfigurationException} among them, are
     * reported without stack trace.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new BenchmarkCLI())
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof IllegalArgumentException) {
                        logger.error(ex.getMessage());
                        return CONFIGURATION_ERROR;
                    }
                    throw ex;
                })
                .execute(args);
    }
}
