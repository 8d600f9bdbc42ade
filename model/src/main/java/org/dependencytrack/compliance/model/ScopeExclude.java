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

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.util.Objects.requireNonNull;

/**
 * Marks all {@link Scope}s whose name matches {@link #pattern()} as excluded,
 * i.e. not part of the distributed artifacts.
 *
 * @param pattern Regular expression that scope names must match in full
 * @param reason  Why the scopes are excluded
 * @param comment Additional explanation
 * @since 1.0.0
 */
public record ScopeExclude(String pattern, Reason reason, @Nullable String comment) {

    public enum Reason {
        BUILD_DEPENDENCY_OF,
        DEV_DEPENDENCY_OF,
        DOCUMENTATION_DEPENDENCY_OF,
        PROVIDED_BY,
        TEST_DEPENDENCY_OF
    }

    public ScopeExclude {
        requireNonNull(pattern, "pattern must not be null");
        requireNonNull(reason, "reason must not be null");
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid scope exclude pattern: " + pattern, e);
        }
    }

    public boolean matches(final String scopeName) {
        return Pattern.matches(pattern, scopeName);
    }

}
