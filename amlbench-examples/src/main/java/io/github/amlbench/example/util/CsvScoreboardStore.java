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

import io.github.amlbench.results.Scoreboard;
import io.github.amlbench.results.ScoreboardStore;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Scoreboard store appending rows to CSV files, based on Apache Commons CSV.
 * <p>
 * The header is written with the first row. When a board brings columns the file does not have
 * yet (e.g. a metric never reported before), the file is rewritten with the extended header, the
 * earlier rows leaving the new columns empty.
 */
public class CsvScoreboardStore implements ScoreboardStore {
    private static final Logger logger = LoggerFactory.getLogger(CsvScoreboardStore.class);

    private final Function<Scoreboard, Path> fileOf;

    private CsvScoreboardStore(Function<Scoreboard, Path> fileOf) {
        this.fileOf = fileOf;
    }

    /**
     * A store keeping one file per framework and scope:
     * {@code <dir>/<framework>_<task_X|benchmark_Y>.csv}.
     */
    public static CsvScoreboardStore perScope(Path dir) {
        return new CsvScoreboardStore(board -> dir.resolve(
                board.getFrameworkName().toLowerCase(Locale.ROOT) + "_" + board.scope() + ".csv"));
    }

    /** A store appending every board to the same file. */
    public static CsvScoreboardStore singleFile(Path file) {
        return new CsvScoreboardStore(board -> file);
    }

    /** The file the given board is appended to. */
    public Path fileOf(Scoreboard board) {
        return fileOf.apply(board);
    }

    @Override
    public synchronized void append(Scoreboard board) throws IOException {
        Path file = fileOf(board);
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }

        List<String> existingHeader = Files.exists(file) ? readHeader(file) : List.of();
        Set<String> columns = new LinkedHashSet<>(existingHeader);
        columns.addAll(board.columns());
        List<String> header = new ArrayList<>(columns);

        if (!existingHeader.isEmpty() && !existingHeader.equals(header)) {
            logger.debug("Extending the header of {} to {}.", file, header);
            rewrite(file, header);
        }
        boolean exists = Files.exists(file) && Files.size(file) > 0;
        try (Writer writer = Files.newBufferedWriter(file, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder()
                     .setHeader(header.toArray(new String[0]))
                     .setSkipHeaderRecord(exists)
                     .build())) {
            for (Map<String, Object> row : board.asRows()) {
                List<Object> values = new ArrayList<>(header.size());
                for (String column : header) {
                    values.add(format(row.get(column)));
                }
                printer.printRecord(values);
            }
        }
        logger.info("Scores saved to {}.", file);
    }

    /**
     * Rows of a store file as column-to-value maps, in file order.
     * @throws IOException if the file cannot be read
     */
    public static List<Map<String, String>> readRows(Path file) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>();
        if (!Files.exists(file)) {
            return rows;
        }
        try (Reader reader = Files.newBufferedReader(file);
             CSVParser parser = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build().parse(reader)) {
            for (CSVRecord record : parser) {
                rows.add(new LinkedHashMap<>(record.toMap()));
            }
        }
        return rows;
    }

    private static List<String> readHeader(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file);
             CSVParser parser = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build().parse(reader)) {
            return new ArrayList<>(parser.getHeaderNames());
        }
    }

    private static void rewrite(Path file, List<String> header) throws IOException {
        List<Map<String, String>> rows = readRows(file);
        try (Writer writer = Files.newBufferedWriter(file);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder()
                     .setHeader(header.toArray(new String[0]))
                     .build())) {
            for (Map<String, String> row : rows) {
                List<Object> values = new ArrayList<>(header.size());
                for (String column : header) {
                    values.add(row.getOrDefault(column, ""));
                }
                printer.printRecord(values);
            }
        }
    }

    private static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double && ((Double) value).isNaN()) {
            return "";
        }
        return value.toString();
    }
}
