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
 * Thrown when a region is released with a size other than the one it was reserved with.
 *
 * <p>The region stays reserved; the caller can retry with the correct size.
 *
 * @since 1.0.0
 */
public final class SizeMismatchException extends AcException {

    private final int ptr;
    private final int expectedSize;
    private final int actualSize;

    public SizeMismatchException(int ptr, int expectedSize, int actualSize) {
        super("libac: Size mismatch releasing region at " + ptr + ": reserved " + expectedSize
            + " bytes, release requested " + actualSize);
        this.ptr = ptr;
        this.expectedSize = expectedSize;
        this.actualSize = actualSize;
    }

    public int getPtr() {
        return ptr;
    }

    public int getExpectedSize() {
        return expectedSize;
    }

    public int getActualSize() {
        return actualSize;
    }
}
