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
 * Thrown when bytes read from linear memory are not well-formed UTF-8.
 *
 * @since 1.0.0
 */
public final class InvalidEncodingException extends AcException {

    private final int ptr;
    private final int errorOffset;

    /**
     * @param ptr start of the decoded range in linear memory
     * @param errorOffset offset of the first malformed byte, relative to {@code ptr}
     * @param cause the decoder failure
     */
    public InvalidEncodingException(int ptr, int errorOffset, Throwable cause) {
        super("libac: Invalid UTF-8 at byte " + errorOffset + " of region at " + ptr, cause);
        this.ptr = ptr;
        this.errorOffset = errorOffset;
    }

    public int getPtr() {
        return ptr;
    }

    public int getErrorOffset() {
        return errorOffset;
    }
}
