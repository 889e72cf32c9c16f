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

package io.github.amlbench.example.frameworks;

import io.github.amlbench.benchmark.TaskConfig;
import io.github.amlbench.data.DataSplit;
import io.github.amlbench.data.Dataset;
import io.github.amlbench.data.Feature;
import io.github.amlbench.data.TaskType;
import io.github.amlbench.framework.FrameworkAdapter;
import io.github.amlbench.framework.MetaResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Baseline framework predicting a constant: the most frequent class of the training split for
 * classification, the mean of the training target for regression.
 * <p>
 * With the {@code encode} param set, class labels are replaced by their index in the target's
 * categories, in predictions and truth alike.
 */
public class ConstantPredictor implements FrameworkAdapter {
    private static final Logger logger = LoggerFactory.getLogger(ConstantPredictor.class);

    public static final String NAME = "constantpredictor";

    @Override
    public MetaResult run(Dataset dataset, TaskConfig config) throws IOException {
        long start = System.nanoTime();
        Feature target = dataset.target();
        DataSplit train = dataset.train();
        DataSplit test = dataset.test();
        if (train.size() == 0) {
            throw new IllegalArgumentException("Training split of " + config.getName() + " is empty");
        }

        List<String> trainTarget = train.column(target.index());
        String constant = config.getType() == TaskType.CLASSIFICATION
                ? mostFrequent(trainTarget)
                : Double.toString(mean(trainTarget));
        List<String> truth = test.column(target.index());
        if (isEncoded(config) && config.getType() == TaskType.CLASSIFICATION) {
            constant = encode(target, constant);
            truth = encodeAll(target, truth);
        }
        List<String> predictions = Collections.nCopies(truth.size(), constant);
        double trainingDuration = (System.nanoTime() - start) / 1_000_000_000.0;
        logger.debug("Predicting {} for the {} test rows of {} fold {}.", constant, truth.size(), config.getName(), config.getFold());

        var result = new MetaResult.Builder()
                .withPredictions(predictions, truth)
                .withTrainingDurationSeconds(trainingDuration)
                .withModelsCount(1);
        if (config.getOutputPredictionsFile() != null) {
            writePredictions(config.getOutputPredictionsFile(), predictions, truth);
            result.withPredictionsFile(config.getOutputPredictionsFile());
        }
        return result.build();
    }

    static boolean isEncoded(TaskConfig config) {
        Object encode = config.getFrameworkParams().get("encode");
        return encode != null && Boolean.parseBoolean(encode.toString());
    }

    static String mostFrequent(List<String> values) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String v : values) {
            counts.merge(v, 1, Integer::sum);
        }
        String best = null;
        int bestCount = -1;
        for (var e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    static double mean(List<String> values) {
        double sum = 0;
        for (String v : values) {
            sum += Double.parseDouble(v);
        }
        return sum / values.size();
    }

    private static String encode(Feature target, String label) {
        return Integer.toString(target.values().indexOf(label));
    }

    private static List<String> encodeAll(Feature target, List<String> labels) {
        List<String> encoded = new ArrayList<>(labels.size());
        for (String label : labels) {
            encoded.add(encode(target, label));
        }
        return encoded;
    }

    private static void writePredictions(Path file, List<String> predictions, List<String> truth) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (Writer writer = Files.newBufferedWriter(file);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder()
                     .setHeader("predictions", "truth")
                     .build())) {
            for (int i = 0; i < predictions.size(); i++) {
                printer.printRecord(predictions.get(i), truth.get(i));
            }
        }
    }
}
