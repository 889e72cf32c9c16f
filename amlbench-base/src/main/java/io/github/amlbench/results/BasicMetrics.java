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

package io.github.amlbench.results;

import io.github.amlbench.data.TaskType;
import io.github.amlbench.framework.MetaResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Metrics computable from hard predictions alone: {@code acc} for classification, and
 * {@code mae}, {@code mse}, {@code rmse}, {@code r2} for regression. Any other metric scores NaN.
 */
public class BasicMetrics implements MetricEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(BasicMetrics.class);

    @Override
    public double score(String metric, TaskType type, MetaResult result) {
        List<String> predictions = result.getPredictions();
        List<String> truth = result.getTruth();
        if (truth.isEmpty()) {
            return Double.NaN;
        }
        switch (metric.toLowerCase(Locale.ROOT)) {
            case "acc":
                return accuracy(predictions, truth);
            case "mae":
                return type == TaskType.REGRESSION ? mae(toDoubles(predictions), toDoubles(truth)) : Double.NaN;
            case "mse":
                return type == TaskType.REGRESSION ? mse(toDoubles(predictions), toDoubles(truth)) : Double.NaN;
            case "rmse":
                return type == TaskType.REGRESSION ? Math.sqrt(mse(toDoubles(predictions), toDoubles(truth))) : Double.NaN;
            case "r2":
                return type == TaskType.REGRESSION ? r2(toDoubles(predictions), toDoubles(truth)) : Double.NaN;
            default:
                logger.warn("Metric {} is not supported, its score is reported as NaN.", metric);
                return Double.NaN;
        }
    }

    static double accuracy(List<String> predictions, List<String> truth) {
        int correct = 0;
        for (int i = 0; i < truth.size(); i++) {
            if (truth.get(i).equals(predictions.get(i))) {
                correct++;
            }
        }
        return (double) correct / truth.size();
    }

    static double mae(double[] predictions, double[] truth) {
        double sum = 0;
        for (int i = 0; i < truth.length; i++) {
            sum += Math.abs(predictions[i] - truth[i]);
        }
        return sum / truth.length;
    }

    static double mse(double[] predictions, double[] truth) {
        double sum = 0;
        for (int i = 0; i < truth.length; i++) {
            double d = predictions[i] - truth[i];
            sum += d * d;
        }
        return sum / truth.length;
    }

    static double r2(double[] predictions, double[] truth) {
        double mean = 0;
        for (double t : truth) {
            mean += t;
        }
        mean /= truth.length;
        double ssTot = 0;
        double ssRes = 0;
        for (int i = 0; i < truth.length; i++) {
            ssTot += (truth[i] - mean) * (truth[i] - mean);
            ssRes += (truth[i] - predictions[i]) * (truth[i] - predictions[i]);
        }
        // constant truth: r2 is undefined unless the fit is perfect
        if (ssTot == 0) {
            return ssRes == 0 ? 1.0 : 0.0;
        }
        return 1 - ssRes / ssTot;
    }

    private static double[] toDoubles(List<String> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = Double.parseDouble(values.get(i));
        }
        return out;
    }
}
