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
 * Dataset fully held in memory. Releasing it drops the references to its splits.
 */
public class TabularDataset extends AbstractDataset {
    private final String name;
    private final Feature target;
    private final List<Feature> features;
    private volatile DataSplit train;
    private volatile DataSplit test;

    public TabularDataset(String name, Feature target, List<Feature> features, DataSplit train, DataSplit test) {
        this.name = name;
        this.target = target;
        this.features = List.copyOf(features);
        this.train = train;
        this.test = test;
    }

    @Override
    public Feature target() {
        return target;
    }

    @Override
    public List<Feature> features() {
        return features;
    }

    @Override
    public DataSplit train() {
        return checkAvailable(train);
    }

    @Override
    public DataSplit test() {
        return checkAvailable(test);
    }

    private DataSplit checkAvailable(DataSplit split) {
        if (isReleased()) {
            throw new IllegalStateException("Dataset " + name + " has already been released");
        }
        return split;
    }

    @Override
    protected void doRelease() {
        train = null;
        test = null;
    }

    @Override
    public String toString() {
        return name;
    }
}
