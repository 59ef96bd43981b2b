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
 * Thrown when a matcher handle does not identify a registered automaton.
 *
 * @since 1.0.0
 */
public final class InvalidHandleException extends AcException {

    private final int handle;
    private final int registered;

    public InvalidHandleException(int handle, int registered) {
        super("libac: Invalid matcher handle: " + Integer.toUnsignedString(handle)
            + " (registered matchers: " + registered + ")");
        this.handle = handle;
        this.registered = registered;
    }

    public int getHandle() {
        return handle;
    }

    public int getRegistered() {
        return registered;
    }
}
