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

import java.io.IOException;

/**
 * Loads (and possibly caches) the data of a task fold.
 */
public interface DatasetService {
    /**
     * @param taskId external task id, which determines the dataset and its fold splits
     * @param fold fold index
     * @return a new dataset handle, exclusively owned by the caller
     */
    Dataset load(int taskId, int fold) throws IOException;
}
