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

package io.github.amlbench.framework;

import java.util.Locale;

/**
 * How framework setup is handled before a benchmark runs.
 */
public enum SetupMode {
    /** Set up unless a previous setup left its marker file. */
    AUTO,
    /** Never set up. */
    SKIP,
    /** Always set up, ignoring the marker file. */
    FORCE,
    /** Set up, then stop without running any task. */
    ONLY;

    public static SetupMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid setup mode '" + value + "', expected one of auto, skip, force, only", e);
        }
    }
}
