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

package io.github.amlbench.framework;

import io.github.amlbench.TestUtil;
import io.github.amlbench.benchmark.TaskConfig;
import io.github.amlbench.data.Dataset;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestFrameworkSetup {
    private Path testDirectory;
    private AtomicInteger setups;
    private final FrameworkSetup frameworkSetup = new FrameworkSetup();

    @Before
    public void setup() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
        setups = new AtomicInteger();
    }

    @After
    public void tearDown() {
        TestUtil.deleteQuietly(testDirectory);
    }

    private Framework framework(String setupCmd) {
        FrameworkAdapter adapter = new FrameworkAdapter() {
            @Override
            public MetaResult run(Dataset dataset, TaskConfig config) {
                throw new UnsupportedOperationException();
            }

            @Override
            public void setup(String setupArgs) {
                setups.incrementAndGet();
            }
        };
        return new FrameworkRegistry(testDirectory)
                .register(new FrameworkDefinition.Builder("counting").withSetupCmd(setupCmd).build(), adapter)
                .resolve("counting");
    }

    @Test
    public void testSkipNeverSetsUp() throws IOException {
        Framework fw = framework(null);
        assertFalse(frameworkSetup.setup(fw, SetupMode.SKIP));
        assertEquals(0, setups.get());
        assertFalse(frameworkSetup.isSetupDone(fw));
    }

    @Test
    public void testAutoSetsUpOnce() throws IOException {
        Framework fw = framework(null);
        assertTrue(frameworkSetup.setup(fw, SetupMode.AUTO));
        assertTrue(Files.isRegularFile(fw.getDirectory().resolve(FrameworkSetup.MARKER_FILE)));
        assertFalse(frameworkSetup.setup(fw, SetupMode.AUTO));
        assertEquals(1, setups.get());
    }

    @Test
    public void testForceAndOnlyIgnoreTheMarker() throws IOException {
        Framework fw = framework(null);
        assertTrue(frameworkSetup.setup(fw, SetupMode.AUTO));
        assertTrue(frameworkSetup.setup(fw, SetupMode.FORCE));
        assertTrue(frameworkSetup.setup(fw, SetupMode.ONLY));
        assertEquals(3, setups.get());
    }

    @Test
    public void testSetupCommandRunsInFrameworkDirectory() throws IOException {
        Framework fw = framework("echo installed > installed.txt");
        assertTrue(frameworkSetup.setup(fw, SetupMode.AUTO));
        assertEquals("installed", Files.readString(fw.getDirectory().resolve("installed.txt")).trim());
    }

    @Test
    public void testFailingSetupCommandLeavesNoMarker() {
        Framework fw = framework("exit 3");
        var e = assertThrows(IOException.class, () -> frameworkSetup.setup(fw, SetupMode.AUTO));
        assertTrue(e.getMessage().contains("status 3"));
        assertFalse(frameworkSetup.isSetupDone(fw));
    }

    @Test
    public void testParseSetupMode() {
        assertEquals(SetupMode.ONLY, SetupMode.parse(" Only "));
        assertEquals(SetupMode.SKIP, SetupMode.parse("skip"));
        assertThrows(IllegalArgumentException.class, () -> SetupMode.parse("sometimes"));
    }
}
