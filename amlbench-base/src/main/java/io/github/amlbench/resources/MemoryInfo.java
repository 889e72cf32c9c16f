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
 * Snapshot of system memory, in MB.
 */
public final class MemoryInfo {
    private final long totalMb;
    private final long availableMb;

    public MemoryInfo(long totalMb, long availableMb) {
        this.totalMb = totalMb;
        this.availableMb = availableMb;
    }

    public long totalMb() {
        return totalMb;
    }

    public long availableMb() {
        return availableMb;
    }

    @Override
    public String toString() {
        return "MemoryInfo{total=" + totalMb + "MB, available=" + availableMb + "MB}";
    }
}
