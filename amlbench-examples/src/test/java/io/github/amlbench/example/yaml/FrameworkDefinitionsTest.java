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

package io.github.amlbench.example.yaml;

import io.github.amlbench.example.frameworks.ConstantPredictor;
import io.github.amlbench.framework.Framework;
import io.github.amlbench.framework.FrameworkDefinition;
import io.github.amlbench.framework.FrameworkRegistry;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class FrameworkDefinitionsTest {
    private static List<FrameworkDefinition> parse(String yaml) {
        return FrameworkDefinitions.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testBundledDefinitions() throws IOException {
        List<FrameworkDefinition> definitions = FrameworkDefinitions.loadDefault();
        assertEquals(List.of("constantpredictor", "constantpredictor_enc"),
                definitions.stream().map(FrameworkDefinition::getName).collect(Collectors.toList()));

        Framework enc = new FrameworkRegistry(Paths.get("frameworks"))
                .registerDefinitions(definitions)
                .registerAdapter(ConstantPredictor.NAME, new ConstantPredictor())
                .resolve("ConstantPredictor_Enc");
        assertEquals("latest", enc.getDefinition().getVersion());
        assertEquals(ConstantPredictor.NAME, enc.getDefinition().getAdapter());
        assertEquals(Map.of("encode", true), enc.getDefinition().getParams());
        assertTrue(enc.getAdapter() instanceof ConstantPredictor);
    }

    @Test
    public void testAllFields() {
        FrameworkDefinition def = parse(
                "autogluon:\n"
                        + "  version: '0.8.2'\n"
                        + "  module: gluon\n"
                        + "  setup_args: '--quiet'\n"
                        + "  setup_cmd: pip install autogluon\n"
                        + "  project: https://auto.gluon.ai\n"
                        + "  params:\n"
                        + "    presets: best_quality\n"
                        + "    num_bag_folds: 5\n").get(0);
        assertEquals("autogluon", def.getName());
        assertEquals("0.8.2", def.getVersion());
        assertEquals("gluon", def.getAdapter());
        assertEquals("--quiet", def.getSetupArgs());
        assertEquals("pip install autogluon", def.getSetupCmd());
        assertEquals("https://auto.gluon.ai", def.getProject());
        assertEquals(Map.of("presets", "best_quality", "num_bag_folds", 5), def.getParams());
        assertNull(def.getParent());
    }

    @Test
    public void testDocumentationEntriesAreSkipped() {
        List<FrameworkDefinition> definitions = parse(
                "__defaults:\n  version: ''\n"
                        + "tpot:\n  version: stable\n"
                        + "tpot_fast:\n  extends: tpot\n");
        assertEquals(2, definitions.size());
        assertEquals("tpot", definitions.get(1).getParent());
        assertEquals("tpot_fast", definitions.get(1).getName());
    }

    @Test
    public void testEmptyAndInvalidFiles() {
        assertTrue(parse("").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> parse("tpot:\n  params: [1, 2]\n"));
        assertThrows(FileNotFoundException.class, () -> FrameworkDefinitions.load(Paths.get("no", "such", "frameworks.yaml")));
    }
}
