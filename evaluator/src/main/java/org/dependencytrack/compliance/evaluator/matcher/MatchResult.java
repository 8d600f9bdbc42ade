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
package org.dependencytrack.compliance.evaluator.matcher;

import static java.util.Objects.requireNonNull;

/**
 * Result of evaluating a {@link Matcher}.
 *
 * @since 1.0.0
 */
public sealed interface MatchResult {

    /**
     * @param description Description of the condition that matched.
     */
    record Matched(String description) implements MatchResult {

        public Matched {
            requireNonNull(description, "description must not be null");
        }

    }

    /**
     * @param description Description of the condition that did not match.
     */
    record NotMatched(String description) implements MatchResult {

        public NotMatched {
            requireNonNull(description, "description must not be null");
        }

    }

    /**
     * Indicates that the condition could not be evaluated, e.g. because
     * the evaluation context lacks data the condition depends on.
     *
     * @param description Description of the condition that failed.
     * @param reason      Why the condition could not be evaluated.
     */
    record Failed(String description, String reason) implements MatchResult {

        public Failed {
            requireNonNull(description, "description must not be null");
            requireNonNull(reason, "reason must not be null");
        }

    }

    default boolean isMatched() {
        return this instanceof Matched;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

}
