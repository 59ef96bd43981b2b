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
 * Base exception for all libac errors.
 *
 * <p>Sealed class ensuring exhaustive handling of all error types raised at the boundary.
 *
 * @since 1.0.0
 */
public sealed class AcException extends RuntimeException
    permits InvalidHandleException,
            InvalidEncodingException,
            SizeMismatchException,
            CapacityExceededException,
            InvalidRegionException,
            ResourceException {

    public AcException(String message) {
        super(message);
    }

    public AcException(String message, Throwable cause) {
        super(message, cause);
    }
}
