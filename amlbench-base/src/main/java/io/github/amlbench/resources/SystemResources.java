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

/**
 * Live view of the machine's capacity. Every call reads the current figures; nothing is cached,
 * since system load changes between jobs.
 */
public interface SystemResources {
    /** Number of cores visible to this process. */
    int cores();

    /** Current physical memory figures. */
    MemoryInfo memory();

    /** Reads the figures of the machine running this JVM. */
    static SystemResources local() {
        return new OperatingSystemResources();
    }

    /** Fixed figures, useful when estimating against a known machine profile. */
    static SystemResources fixed(int cores, long totalMb, long availableMb) {
        MemoryInfo info = new MemoryInfo(totalMb, availableMb);
        return new SystemResources() {
            @Override
            public int cores() {
                return cores;
            }

            @Override
            public MemoryInfo memory() {
                return info;
            }
        };
    }
}
