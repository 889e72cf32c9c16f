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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the core and memory budget of a job from its requested values and the live system
 * capacity.
 * <p>
 * The budget is advisory: it is handed to the framework adapter, nothing enforces it, and jobs
 * running concurrently each get their own estimate. {@link #estimate} must be called right before
 * a job is dispatched, never reused across jobs.
 */
public class ResourceEstimator {
    private static final Logger logger = LoggerFactory.getLogger(ResourceEstimator.class);

    private final SystemResources system;
    private final int osMemSizeMb;

    /**
     * @param system live system figures
     * @param osMemSizeMb memory (MB) recommended to leave to the OS
     */
    public ResourceEstimator(SystemResources system, int osMemSizeMb) {
        this.system = system;
        this.osMemSizeMb = osMemSizeMb;
    }

    public int getOsMemSizeMb() {
        return osMemSizeMb;
    }

    /**
     * Reads the current system figures and resolves the budget for one job, logging any advisory.
     *
     * @param taskName used in log lines only
     * @param requestedCores cores asked for by the task, 0 or less for all
     * @param requestedMemMb memory asked for by the task, 0 or less when unspecified
     */
    public ResourceBudget estimate(String taskName, int requestedCores, long requestedMemMb) {
        int sysCores = system.cores();
        MemoryInfo mem = system.memory();

        int cores = resolveCores(requestedCores, sysCores);
        logger.info("Assigning {} cores (total={}) for new task {}.", cores, sysCores, taskName);

        long memory = resolveMemory(requestedMemMb, mem, osMemSizeMb);
        logger.info("Assigning {}MB (total={}MB) for new {} task.", memory, mem.totalMb(), taskName);

        ResourceAdvisory advisory = advise(memory, mem, osMemSizeMb);
        if (advisory == ResourceAdvisory.EXCEEDS_AVAILABLE_MEMORY) {
            logger.warn("Assigned memory ({}MB) exceeds system available memory ({}MB / total={}MB)!",
                    memory, mem.availableMb(), mem.totalMb());
        } else if (advisory == ResourceAdvisory.WITHIN_OS_BUFFER) {
            logger.warn("Assigned memory ({}MB) is within {}MB of system total memory ({}MB): "
                            + "we recommend a {}MB buffer, otherwise OS memory usage might interfere with the benchmark task.",
                    memory, osMemSizeMb, mem.totalMb(), osMemSizeMb);
        }
        return new ResourceBudget(cores, memory, sysCores, mem, advisory);
    }

    /** {@code min(requested, system)} when requested is positive, else all system cores. */
    public static int resolveCores(int requested, int systemCores) {
        return requested > 0 ? Math.min(requested, systemCores) : systemCores;
    }

    /**
     * The requested memory if positive; otherwise the available memory minus half the OS headroom
     * (the OS already uses part of it), if that is positive; otherwise the available memory.
     */
    public static long resolveMemory(long requested, MemoryInfo mem, int osMemSizeMb) {
        if (requested > 0) {
            return requested;
        }
        long leftForApp = (long) (mem.availableMb() - osMemSizeMb / 2.0);
        return leftForApp > 0 ? leftForApp : mem.availableMb();
    }

    /**
     * At most one advisory is reported: exceeding the available memory takes precedence over
     * eating into the OS buffer.
     */
    public static ResourceAdvisory advise(long assignedMb, MemoryInfo mem, int osMemSizeMb) {
        if (assignedMb > mem.availableMb()) {
            return ResourceAdvisory.EXCEEDS_AVAILABLE_MEMORY;
        }
        if (assignedMb > mem.totalMb() - osMemSizeMb) {
            return ResourceAdvisory.WITHIN_OS_BUFFER;
        }
        return null;
    }
}
