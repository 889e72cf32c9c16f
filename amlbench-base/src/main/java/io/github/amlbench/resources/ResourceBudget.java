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

package io.github.amlbench.resources;

import java.util.Optional;

/**
 * Cores and memory assigned to one job, together with the system figures they were computed from.
 */
public final class ResourceBudget {
    private final int cores;
    private final long memoryMb;
    private final int systemCores;
    private final MemoryInfo systemMemory;
    private final ResourceAdvisory advisory;

    public ResourceBudget(int cores, long memoryMb, int systemCores, MemoryInfo systemMemory, ResourceAdvisory advisory) {
        this.cores = cores;
        this.memoryMb = memoryMb;
        this.systemCores = systemCores;
        this.systemMemory = systemMemory;
        this.advisory = advisory;
    }

    public int cores() {
        return cores;
    }

    public long memoryMb() {
        return memoryMb;
    }

    public int systemCores() {
        return systemCores;
    }

    public MemoryInfo systemMemory() {
        return systemMemory;
    }

    public Optional<ResourceAdvisory> advisory() {
        return Optional.ofNullable(advisory);
    }

    @Override
    public String toString() {
        return "ResourceBudget{cores=" + cores + ", memoryMb=" + memoryMb
                + ", systemCores=" + systemCores + ", systemMemory=" + systemMemory
                + (advisory == null ? "" : ", advisory=" + advisory) + '}';
    }
}
