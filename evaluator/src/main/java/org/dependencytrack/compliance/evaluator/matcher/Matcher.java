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

/**
 * A side-effect free condition, bound to the context it is evaluated in.
 * <p>
 * Evaluation is lazy and can be repeated any number of times with the same result.
 *
 * @since 1.0.0
 */
public interface Matcher {

    /**
     * @return Human-readable description of the condition
     */
    String description();

    MatchResult evaluate();

    /**
     * @return {@code true} when the condition matched, {@code false} when it did not match or failed
     */
    default boolean matches() {
        return evaluate().isMatched();
    }

    default Matcher and(final Matcher other) {
        return Matchers.allOf(this, other);
    }

    default Matcher or(final Matcher other) {
        return Matchers.anyOf(this, other);
    }

    default Matcher negate() {
        return Matchers.not(this);
    }

}
