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

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * {@link SystemResources} backed by the platform management beans.
 */
class OperatingSystemResources implements SystemResources {
    private static final long MB = 1024L * 1024L;

    private final OperatingSystemMXBean osBean;
    /** Platform-specific OS bean for physical memory figures. */
    private final com.sun.management.OperatingSystemMXBean sunOsBean;

    OperatingSystemResources() {
        this.osBean = ManagementFactory.getOperatingSystemMXBean();
        this.sunOsBean = (com.sun.management.OperatingSystemMXBean) osBean;
    }

    @Override
    public int cores() {
        return osBean.getAvailableProcessors();
    }

    @Override
    public MemoryInfo memory() {
        return new MemoryInfo(
                sunOsBean.getTotalMemorySize() / MB,
                sunOsBean.getFreeMemorySize() / MB
        );
    }
}
