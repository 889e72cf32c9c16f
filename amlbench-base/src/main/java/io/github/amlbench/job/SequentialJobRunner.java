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

package io.github.amlbench.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs jobs one after the other on the calling thread. Completions come back in submission order.
 */
public class SequentialJobRunner implements JobRunner {
    private static final Logger logger = LoggerFactory.getLogger(SequentialJobRunner.class);

    @Override
    public List<JobCompletion> run(List<Job> jobs) {
        logger.info("Running {} jobs sequentially.", jobs.size());
        List<JobCompletion> completions = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            completions.add(job.run());
        }
        return completions;
    }
}
