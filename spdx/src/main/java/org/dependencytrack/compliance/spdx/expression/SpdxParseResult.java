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
package org.dependencytrack.compliance.spdx.expression;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Result of parsing an SPDX license expression with {@link SpdxExpressionParser}.
 *
 * @since 1.0.0
 */
public sealed interface SpdxParseResult {

    /**
     * Indicates that the input was a valid expression.
     *
     * @param expression The parsed expression.
     */
    record Success(SpdxExpression expression) implements SpdxParseResult {

        public Success {
            requireNonNull(expression, "expression must not be null");
        }

    }

    /**
     * Indicates that the input was not a valid expression.
     *
     * @param reason Human-readable reason for the failure.
     */
    record Failure(String reason) implements SpdxParseResult {

        public Failure {
            requireNonNull(reason, "reason must not be null");
        }

    }

    /**
     * @return The parsed expression, or {@link Optional#empty()} if parsing failed
     */
    default Optional<SpdxExpression> toOptional() {
        if (this instanceof final Success success) {
            return Optional.of(success.expression());
        }

        return Optional.empty();
    }

}
