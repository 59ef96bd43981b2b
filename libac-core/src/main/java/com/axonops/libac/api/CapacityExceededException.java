/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libac.api;

/**
 * Thrown by a scan when more matches existed than the output capacity and the exports are
 * configured with {@link com.axonops.libac.config.AcConfig#failOnTruncation()}.
 *
 * <p>The first {@code capacity} matches have already been written when this is thrown.
 *
 * @since 1.0.0
 */
public final class CapacityExceededException extends AcException {

    private final int capacity;

    public CapacityExceededException(int capacity) {
        super("libac: More matches than output capacity " + capacity + ", excess matches dropped");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
