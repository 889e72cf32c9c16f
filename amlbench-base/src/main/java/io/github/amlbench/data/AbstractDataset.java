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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class guaranteeing that {@link #doRelease()} runs at most once, whichever thread calls
 * {@link #release()} and however many times.
 */
public abstract class AbstractDataset implements Dataset {
    private static final Logger logger = LoggerFactory.getLogger(AbstractDataset.class);

    private final AtomicBoolean released = new AtomicBoolean(false);

    @Override
    public final void release() {
        if (released.compareAndSet(false, true)) {
            doRelease();
            logger.debug("Released dataset {}.", this);
        }
    }

    @Override
    public final boolean isReleased() {
        return released.get();
    }

    /** Frees the underlying resources. Called once. */
    protected abstract void doRelease();
}
