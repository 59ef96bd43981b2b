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
 * Thrown when a pointer/length pair does not describe memory the caller may use.
 *
 * <p>Covers reads and writes outside linear memory or outside any live reservation, releases of
 * pointers that were never reserved or were already released, and negative sizes.
 *
 * @since 1.0.0
 */
public final class InvalidRegionException extends AcException {

    public InvalidRegionException(String message) {
        super("libac: Invalid region: " + message);
    }
}
