/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.changepoint;

import lombok.Getter;

/**
 * Thrown when a segment is shorter than the length an operation requires.
 */
@Getter
public class SegmentLengthException extends IllegalArgumentException {

    private final int start;
    private final int end;
    private final int minimumLength;

    public SegmentLengthException(int start, int end, int minimumLength) {
        super("segment [" + start + ", " + end + ") is too short, it must hold at least " + minimumLength
                + " sample(s)");
        this.start = start;
        this.end = end;
        this.minimumLength = minimumLength;
    }
}
