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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the one-off setup of a framework: the adapter's own {@link FrameworkAdapter#setup} followed
 * by the definition's setup command, if any. A marker file in the framework directory records a
 * completed setup so that {@link SetupMode#AUTO} does not repeat it.
 */
public class FrameworkSetup {
    private static final Logger logger = LoggerFactory.getLogger(FrameworkSetup.class);

    static final String MARKER_FILE = ".marker_setup_safe_to_delete";

    /**
     * @return true if setup was performed, false if it was skipped
     * @throws IOException if the setup command fails or the marker cannot be written
     */
    public boolean setup(Framework framework, SetupMode mode) throws IOException {
        if (mode == SetupMode.SKIP) {
            return false;
        }
        if (mode == SetupMode.AUTO && isSetupDone(framework)) {
            logger.debug("Framework {} already set up, skipping.", framework.getName());
            return false;
        }

        logger.info("Setting up framework {}.", framework.getName());
        FrameworkDefinition def = framework.getDefinition();
        try {
            framework.getAdapter().setup(def.getSetupArgs());
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Setup of framework " + framework.getName() + " failed", e);
        }
        if (def.getSetupCmd() != null) {
            String output = runCommand(def.getSetupCmd(), framework.getDirectory());
            logger.debug(output);
        }
        logger.info("Setup of framework {} completed successfully.", framework.getName());

        touchMarker(framework);
        return true;
    }

    public boolean isSetupDone(Framework framework) {
        return Files.isRegularFile(framework.getDirectory().resolve(MARKER_FILE));
    }

    private void touchMarker(Framework framework) throws IOException {
        Path marker = framework.getDirectory().resolve(MARKER_FILE);
        if (!Files.exists(marker)) {
            Files.createDirectories(framework.getDirectory());
            Files.createFile(marker);
        }
    }

    /**
     * Runs a shell command and returns its combined output.
     *
     * @throws IOException if the command exits with a non-zero status
     */
    static String runCommand(String command, Path workDir) throws IOException {
        Files.createDirectories(workDir);
        ProcessBuilder pb = new ProcessBuilder("sh", "-c", command)
                .directory(workDir.toFile())
                .redirectErrorStream(true);
        Process process = pb.start();
        String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        try {
            int exit = process.waitFor();
            if (exit != 0) {
                throw new IOException("Command '" + command + "' exited with status " + exit + ":\n" + output);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running '" + command + "'", e);
        }
        return output;
    }
}
