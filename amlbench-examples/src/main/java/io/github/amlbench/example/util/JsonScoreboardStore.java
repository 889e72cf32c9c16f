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

package io.github.amlbench.example.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.amlbench.results.Scoreboard;
import io.github.amlbench.results.ScoreboardStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the detailed rows of each scoreboard as a pretty-printed JSON array, one file per
 * framework and scope: {@code <dir>/<framework>_<scope>.json}. Rows appended later for the same
 * scope are added to the array. NaN values are written as null.
 */
public class JsonScoreboardStore implements ScoreboardStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonScoreboardStore.class);

    private final Path dir;
    private final ObjectMapper mapper = new ObjectMapper();

    public JsonScoreboardStore(Path dir) {
        this.dir = dir;
    }

    public Path fileOf(Scoreboard board) {
        return dir.resolve(board.getFrameworkName().toLowerCase(Locale.ROOT) + "_" + board.scope() + ".json");
    }

    @Override
    public synchronized void append(Scoreboard board) throws IOException {
        Files.createDirectories(dir);
        Path file = fileOf(board);
        List<Map<String, Object>> rows = new ArrayList<>(read(file));
        for (Map<String, Object> row : board.asRows()) {
            Map<String, Object> clean = new LinkedHashMap<>();
            row.forEach((k, v) -> clean.put(k, v instanceof Double && ((Double) v).isNaN() ? null : v));
            rows.add(clean);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), rows);
        logger.info("Detailed scores saved to {}.", file);
    }

    /**
     * The rows saved so far in the given file, empty if it does not exist.
     * @throws IOException if the file is not a JSON array of objects
     */
    public List<Map<String, Object>> read(Path file) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        return mapper.readValue(file.toFile(), new TypeReference<List<Map<String, Object>>>() { });
    }
}
