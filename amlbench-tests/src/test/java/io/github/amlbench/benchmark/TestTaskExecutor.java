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

import io.github.amlbench.TestUtil;
import io.github.amlbench.data.TaskType;
import io.github.amlbench.data.UnsupportedDatasetShapeException;
import io.github.amlbench.framework.Framework;
import io.github.amlbench.framework.FrameworkDefinition;
import io.github.amlbench.framework.FrameworkRegistry;
import io.github.amlbench.results.NoResult;
import io.github.amlbench.results.Result;
import io.github.amlbench.results.TaskResult;
import io.github.amlbench.task.DatasetReference;
import io.github.amlbench.task.TaskDefinition;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestTaskExecutor {
    private Path testDirectory;
    private TestUtil.InMemoryDatasetService datasets;

    @Before
    public void setup() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
        datasets = new TestUtil.InMemoryDatasetService();
    }

    @After
    public void tearDown() {
        TestUtil.deleteQuietly(testDirectory);
    }

    private TaskExecutor executor(BenchmarkSettings settings) {
        return new TaskExecutor(TestUtil.context(datasets, settings));
    }

    private TaskConfig template(TaskDefinition task, int fold) {
        return TaskConfig.template(task, fold, TestUtil.settings(testDirectory));
    }

    @Test
    public void testSuccessfulRunIsScored() throws IOException {
        Framework fw = TestUtil.registry(testDirectory).resolve(TestUtil.CONSTANT);
        TaskDefinition iris = TestUtil.iris(10);
        Result result = executor(TestUtil.settings(testDirectory)).execute(iris, template(iris, 3), fw);

        assertFalse(result.isNoResult());
        assertEquals(0.5, result.getResult(), 1e-9);
        assertEquals("iris", result.getTask());
        assertEquals(3, result.getFold());
        assertEquals(TestUtil.CONSTANT, result.getFramework());
        assertEquals("1.0", result.getVersion());
        assertEquals("openml.org/t/59", result.getId());
        assertEquals(Integer.valueOf(1), result.getModels());
        assertEquals(1, datasets.loads.get());
        assertTrue(datasets.served.get(0).isReleased());
    }

    @Test
    public void testFailingRunBecomesNoResult() throws IOException {
        Framework fw = TestUtil.registry(testDirectory).resolve(TestUtil.ALWAYS_THROWS);
        TaskDefinition iris = TestUtil.iris(10);
        Result result = executor(TestUtil.settings(testDirectory)).execute(iris, template(iris, 0), fw);

        assertTrue(result instanceof NoResult);
        assertEquals("Error: this adapter always throws", result.getInfo());
        assertTrue(Double.isNaN(result.getResult()));
        assertTrue(Double.isNaN(result.getDuration()));
        assertTrue(datasets.served.get(0).isReleased());
    }

    @Test
    public void testErrorMessageIsTruncated() throws IOException {
        BenchmarkSettings settings = TestUtil.settings(testDirectory).toBuilder().withErrorMaxLength(12).build();
        Framework fw = TestUtil.registry(testDirectory).resolve(TestUtil.ALWAYS_THROWS);
        TaskDefinition iris = TestUtil.iris(10);
        Result result = executor(settings).execute(iris, template(iris, 0), fw);
        assertEquals("Error: th...", result.getInfo());
    }

    @Test
    public void testExceptionWithoutMessage() throws IOException {
        Framework fw = new FrameworkRegistry(testDirectory)
                .register(new FrameworkDefinition.Builder("npe").build(), (dataset, config) -> {
                    throw new NullPointerException();
                })
                .resolve("npe");
        TaskDefinition iris = TestUtil.iris(10);
        Result result = executor(TestUtil.settings(testDirectory)).execute(iris, template(iris, 0), fw);
        assertEquals("Error: NullPointerException", result.getInfo());
    }

    @Test
    public void testUnsupportedDatasetShapes() {
        Framework fw = TestUtil.registry(testDirectory).resolve(TestUtil.CONSTANT);
        TaskExecutor executor = executor(TestUtil.settings(testDirectory));
        for (DatasetReference ref : List.of(DatasetReference.openmlDataset(61), DatasetReference.raw("data/iris.csv"))) {
            TaskDefinition task = TestUtil.iris(10).toBuilder().withDataset(ref).build();
            assertThrows(UnsupportedDatasetShapeException.class, () -> executor.execute(task, template(task, 0), fw));
        }
        TaskDefinition noDataset = new TaskDefinition.Builder("nothing").build();
        assertThrows(UnsupportedDatasetShapeException.class,
                () -> executor.execute(noDataset, template(noDataset, 0), fw));
        assertEquals(0, datasets.loads.get());
    }

    @Test
    public void testAdapterGetsSpecializedConfig() throws IOException {
        AtomicReference<TaskConfig> seen = new AtomicReference<>();
        Framework fw = new FrameworkRegistry(testDirectory)
                .register(new FrameworkDefinition.Builder("MixedCase")
                        .withParams(Map.of("a", 1, "encode", false))
                        .build(), (dataset, config) -> {
                    seen.set(config);
                    return TestUtil.constantAdapter().run(dataset, config);
                })
                .resolve("MixedCase");
        BenchmarkSettings settings = TestUtil.settings(testDirectory).toBuilder()
                .withOverride("f.encode", true)
                .build();
        TaskDefinition iris = TestUtil.iris(10).toBuilder().withCores(4).build();
        TaskConfig template = TaskConfig.template(iris, 2, settings);

        executor(settings).execute(iris, template, fw);

        TaskConfig config = seen.get();
        assertEquals(TaskType.CLASSIFICATION, config.getType());
        assertEquals("MixedCase", config.getFramework());
        assertEquals(Map.of("a", 1, "encode", true), config.getFrameworkParams());
        assertEquals(4, config.getCores());
        assertEquals(8192 - 1024, config.getMaxMemSizeMb());
        assertEquals(settings.getPredictionsDir().resolve("mixedcase_iris_2.csv"), config.getOutputPredictionsFile());
        // the template is left untouched
        assertNull(template.getFramework());
        assertTrue(template.getFrameworkParams().isEmpty());
        assertNull(template.getOutputPredictionsFile());
    }

    @Test
    public void testPredictionsFileName() {
        TaskResult taskResult = new TaskResult(TestUtil.iris(10), 7, testDirectory, null, BenchmarkContext.LOCAL_MODE);
        assertEquals(testDirectory.resolve("autogluon_iris_7.csv"), taskResult.predictionsFile("AutoGluon"));
    }
}
