/*
 * This file is part of Dependency-Track.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (c) OWASP Foundation. All Rights Reserved.
 */
package org.dependencytrack.compliance.model;

import static java.util.Objects.requireNonNull;

/**
 * A range of lines in a file.
 *
 * @param path      Path of the file, relative to the root of the scanned source tree
 * @param startLine First line of the range, starting at 1, or {@value #UNKNOWN_LINE}
 * @param endLine   Last line of the range, or {@value #UNKNOWN_LINE}
 * @since 1.0.0
 */
public record TextLocation(String path, int startLine, int endLine) {

    public static final int UNKNOWN_LINE = -1;

    public TextLocation {
        requireNonNull(path, "path must not be null");
        if (startLine < 1 && startLine != UNKNOWN_LINE) {
            throw new IllegalArgumentException("startLine must be positive or %d, but is %d"
                    .formatted(UNKNOWN_LINE, startLine));
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine must not be smaller than startLine %d, but is %d"
                    .formatted(startLine, endLine));
        }
    }

    public TextLocation(final String path) {
        this(path, UNKNOWN_LINE, UNKNOWN_LINE);
    }

}
