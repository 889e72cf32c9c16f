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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a job whose framework run failed. All scores are NaN and {@link #getInfo()} holds the
 * diagnostic message, already truncated to the configured maximum length.
 */
public final class NoResult extends Result {
    NoResult(Identity identity, List<String> metrics, double duration, String info) {
        super(identity, metrics, nanScores(metrics), duration, null, info);
    }

    private static Map<String, Double> nanScores(List<String> metrics) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String m : metrics) {
            scores.put(m, Double.NaN);
        }
        return scores;
    }

    @Override
    public boolean isNoResult() {
        return true;
    }

    @Override
    public NoResult withDuration(double duration) {
        return new NoResult(identity(), getMetrics(), duration, getInfo());
    }

    /**
     * Prefixes the message with "Error: " and, if the result is longer than {@code maxLength},
     * keeps its first {@code maxLength - 3} characters followed by "...".
     */
    public static String truncateMessage(String message, int maxLength) {
        String msg = "Error: " + message;
        if (msg.length() <= maxLength) {
            return msg;
        }
        if (maxLength < 3) {
            return "...".substring(0, Math.max(maxLength, 0));
        }
        return msg.substring(0, maxLength - 3) + "...";
    }
}
