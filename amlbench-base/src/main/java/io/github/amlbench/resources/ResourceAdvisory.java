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
 * Non-fatal warnings attached to a {@link ResourceBudget}. Execution always proceeds with the
 * resolved budget unchanged.
 */
public enum ResourceAdvisory {
    /** The assigned memory is larger than what the system currently has available. */
    EXCEEDS_AVAILABLE_MEMORY,
    /** The assigned memory leaves less than the recommended OS buffer out of the system total. */
    WITHIN_OS_BUFFER
}
