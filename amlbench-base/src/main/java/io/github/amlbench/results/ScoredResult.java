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

import java.util.List;
import java.util.Map;

/**
 * Result of a job whose framework run completed: one score per requested metric.
 */
public final class ScoredResult extends Result {
    ScoredResult(Identity identity, List<String> metrics, Map<String, Double> scores, double duration, Integer models, String info) {
        super(identity, metrics, scores, duration, models, info);
    }

    @Override
    public boolean isNoResult() {
        return false;
    }

    @Override
    public ScoredResult withDuration(double duration) {
        return new ScoredResult(identity(), getMetrics(), getScores(), duration, getModels(), getInfo());
    }
}
