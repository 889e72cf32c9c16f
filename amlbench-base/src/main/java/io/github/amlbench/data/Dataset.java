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

package io.github.amlbench.data;

import java.util.List;

/**
 * Handle to the train/test data of one task fold. A dataset is owned by the job that loaded it and
 * is never shared between jobs.
 * <p>
 * {@link #release()} frees whatever the dataset holds and may be called any number of times;
 * only the first call has an effect.
 */
public interface Dataset {
    /** The column to predict. Its type decides whether the task is a classification or a regression. */
    Feature target();

    /** Predictor columns, excluding the target. */
    List<Feature> features();

    DataSplit train();

    DataSplit test();

    /** Idempotent. */
    void release();

    boolean isReleased();
}
