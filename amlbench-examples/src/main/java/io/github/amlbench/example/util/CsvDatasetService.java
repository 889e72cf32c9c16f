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

import io.github.amlbench.data.DataSplit;
import io.github.amlbench.data.Dataset;
import io.github.amlbench.data.DatasetService;
import io.github.amlbench.data.Feature;
import io.github.amlbench.data.TabularDataset;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads task folds from CSV files laid out as {@code <inputDir>/<taskId>/train_<fold>.csv} and
 * {@code <inputDir>/<taskId>/test_<fold>.csv}.
 * <p>
 * Both files start with a header row; the last column is the target. A column is categorical when
 * any non-empty training value is not a number.
 */
public class CsvDatasetService implements DatasetService {
    private static final Logger logger = LoggerFactory.getLogger(CsvDatasetService.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .build();

    private final Path inputDir;

    public CsvDatasetService(Path inputDir) {
        this.inputDir = inputDir;
    }

    @Override
    public Dataset load(int taskId, int fold) throws IOException {
        Path taskDir = inputDir.resolve(Integer.toString(taskId));
        DataSplit train = read(taskDir.resolve("train_" + fold + ".csv"));
        DataSplit test = read(taskDir.resolve("test_" + fold + ".csv"));
        if (!train.header().equals(test.header())) {
            throw new IOException("Train and test splits of task " + taskId + " fold " + fold + " have different columns");
        }
        if (train.header().isEmpty()) {
            throw new IOException("Task " + taskId + " fold " + fold + " has no columns");
        }

        List<Feature> columns = new ArrayList<>();
        for (int i = 0; i < train.header().size(); i++) {
            columns.add(describe(i, train.header().get(i), train, test));
        }
        Feature target = columns.remove(columns.size() - 1);
        logger.debug("Loaded task {} fold {}: {} train rows, {} test rows, target {}.",
                taskId, fold, train.size(), test.size(), target);
        return new TabularDataset(taskDir.getFileName() + "_" + fold, target, columns, train, test);
    }

    static DataSplit read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new FileNotFoundException(file.toAbsolutePath().toString());
        }
        try (Reader reader = Files.newBufferedReader(file);
             CSVParser parser = FORMAT.parse(reader)) {
            List<String> header = parser.getHeaderNames();
            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                if (record.size() != header.size()) {
                    throw new IOException(file + " line " + record.getRecordNumber() + ": expected "
                            + header.size() + " values, got " + record.size());
                }
                rows.add(record.toList());
            }
            return new DataSplit(file, header, rows);
        }
    }

    private static Feature describe(int index, String name, DataSplit train, DataSplit test) {
        List<String> values = train.column(index);
        boolean categorical = values.stream().anyMatch(v -> !v.isEmpty() && !isNumber(v));
        if (!categorical) {
            return new Feature(index, name, false, List.of());
        }
        Set<String> categories = new LinkedHashSet<>(values);
        categories.addAll(test.column(index));
        categories.remove("");
        return new Feature(index, name, true, new ArrayList<>(categories));
    }

    private static boolean isNumber(String value) {
        try {
            Double.parseDouble(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
