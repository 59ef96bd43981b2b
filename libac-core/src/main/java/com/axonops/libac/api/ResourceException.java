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
 * Thrown when a bounded resource behind the boundary is exhausted.
 *
 * <p>The host cannot fix the call by changing its arguments; it has to release regions or build
 * the exports with larger limits. {@link #getResource()} says which limit was hit.
 *
 * @since 1.0.0
 */
public final class ResourceException extends AcException {

    /** The exhausted resource. */
    public enum Resource {
        /** Linear memory reached {@code maxMemoryBytes} or the 32-bit address range. */
        LINEAR_MEMORY,
        /** Too many regions reserved and not yet released. */
        LIVE_REGIONS,
        /** The matcher registry holds {@code maxRegisteredMatchers} automatons. */
        MATCHER_REGISTRY
    }

    private final Resource resource;

    public ResourceException(Resource resource, String message) {
        super("libac: Resource error (" + resource + "): " + message);
        this.resource = resource;
    }

    public Resource getResource() {
        return resource;
    }
}
