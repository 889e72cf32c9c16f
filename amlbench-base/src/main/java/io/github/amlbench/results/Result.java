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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one job: either a {@link ScoredResult} or a {@link NoResult}. There are no other
 * variants; callers distinguish them with {@link #isNoResult()} or {@code instanceof}.
 * <p>
 * Results are immutable. The only derived copy is {@link #withDuration(double)}, used when the
 * runner reconciles a missing duration with its own wall-clock measurement.
 */
public abstract class Result {
    /** Row columns preceding the per-metric columns, in display order. */
    public static final List<String> COLUMNS = List.of(
            "id", "task", "framework", "version", "fold", "result", "metric",
            "mode", "params", "seed", "utc", "duration", "models", "info");

    private final Identity identity;
    private final List<String> metrics;
    private final Map<String, Double> scores;
    private final double duration;
    private final Integer models;
    private final String info;

    Result(Identity identity, List<String> metrics, Map<String, Double> scores, double duration, Integer models, String info) {
        this.identity = identity;
        this.metrics = List.copyOf(metrics);
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        this.duration = duration;
        this.models = models;
        this.info = info;
    }

    public abstract boolean isNoResult();

    /** A copy of this result reporting the given duration. */
    public abstract Result withDuration(double duration);

    Identity identity() {
        return identity;
    }

    public String getId() {
        return identity.id;
    }

    public String getTask() {
        return identity.task;
    }

    public String getFramework() {
        return identity.framework;
    }

    public String getVersion() {
        return identity.version;
    }

    public int getFold() {
        return identity.fold;
    }

    public String getMode() {
        return identity.mode;
    }

    public String getParams() {
        return identity.params;
    }

    public Integer getSeed() {
        return identity.seed;
    }

    public Instant getUtc() {
        return identity.utc;
    }

    public List<String> getMetrics() {
        return metrics;
    }

    public String getPrimaryMetric() {
        return metrics.get(0);
    }

    /** Score per metric, NaN for metrics that could not be computed. */
    public Map<String, Double> getScores() {
        return scores;
    }

    public double getScore(String metric) {
        Double s = scores.get(metric);
        return s == null ? Double.NaN : s;
    }

    /** Score of the primary metric. */
    public double getResult() {
        return getScore(getPrimaryMetric());
    }

    /** Duration in seconds, NaN when unknown. */
    public double getDuration() {
        return duration;
    }

    public Integer getModels() {
        return models;
    }

    public String getInfo() {
        return info;
    }

    /**
     * The result as a flat row: {@link #COLUMNS} followed by one column per metric.
     * Missing values are null; NaN scores and durations are kept as NaN.
     */
    public Map<String, Object> asRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", identity.id);
        row.put("task", identity.task);
        row.put("framework", identity.framework);
        row.put("version", identity.version);
        row.put("fold", identity.fold);
        row.put("result", getResult());
        row.put("metric", getPrimaryMetric());
        row.put("mode", identity.mode);
        row.put("params", identity.params);
        row.put("seed", identity.seed);
        row.put("utc", identity.utc == null ? null : identity.utc.toString());
        row.put("duration", duration);
        row.put("models", models);
        row.put("info", info);
        for (String m : metrics) {
            row.put(m, getScore(m));
        }
        return row;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + asRow();
    }

    /**
     * Who produced the result: task, fold and framework, with the context of the run.
     */
    static final class Identity {
        final String id;
        final String task;
        final String framework;
        final String version;
        final int fold;
        final String mode;
        final String params;
        final Integer seed;
        final Instant utc;

        Identity(String id, String task, String framework, String version, int fold,
                 String mode, String params, Integer seed, Instant utc) {
            this.id = id;
            this.task = task;
            this.framework = framework;
            this.version = version;
            this.fold = fold;
            this.mode = mode;
            this.params = params;
            this.seed = seed;
            this.utc = utc;
        }
    }
}
