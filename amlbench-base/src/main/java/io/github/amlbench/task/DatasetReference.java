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

package io.github.amlbench.task;

import java.util.Objects;

/**
 * Where the data of a task comes from. A task definition carries exactly one reference.
 * Only {@link Kind#OPENML_TASK} references can currently be loaded.
 */
public final class DatasetReference {
    public enum Kind {
        /** An external task id, which fixes both the dataset and its fold splits. */
        OPENML_TASK,
        /** An external dataset id, without predefined splits. */
        OPENML_DATASET,
        /** A raw dataset specification (paths or inline description). */
        RAW
    }

    private final Kind kind;
    private final String value;

    private DatasetReference(Kind kind, String value) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static DatasetReference openmlTask(int taskId) {
        return new DatasetReference(Kind.OPENML_TASK, Integer.toString(taskId));
    }

    public static DatasetReference openmlDataset(int datasetId) {
        return new DatasetReference(Kind.OPENML_DATASET, Integer.toString(datasetId));
    }

    public static DatasetReference raw(String spec) {
        return new DatasetReference(Kind.RAW, spec);
    }

    public Kind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    /**
     * @return the numeric id for OPENML_TASK and OPENML_DATASET references
     * @throws IllegalStateException for raw references
     */
    public int numericId() {
        if (kind == Kind.RAW) {
            throw new IllegalStateException("Raw dataset references have no numeric id");
        }
        return Integer.parseInt(value);
    }

    /**
     * Public identifier of the dataset, as it appears in the result rows.
     * Raw datasets have none.
     */
    public String publicId() {
        switch (kind) {
            case OPENML_TASK:
                return "openml.org/t/" + value;
            case OPENML_DATASET:
                return "openml.org/d/" + value;
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DatasetReference that = (DatasetReference) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
