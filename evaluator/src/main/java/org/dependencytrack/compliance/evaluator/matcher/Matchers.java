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

import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Factories for {@link Matcher}s.
 * <p>
 * The combinators {@link #allOf(List)}, {@link #anyOf(List)} and {@link #not(Matcher)}
 * short-circuit. When an operand that is evaluated fails, the combinator fails with it.
 *
 * @since 1.0.0
 */
public final class Matchers {

    private Matchers() {
    }

    /**
     * @param description Description of the condition
     * @param condition   The condition to evaluate
     * @return A {@link Matcher} that matches when {@code condition} evaluates to {@code true}
     */
    public static Matcher condition(final String description, final BooleanSupplier condition) {
        requireNonNull(description, "description must not be null");
        requireNonNull(condition, "condition must not be null");

        return new Matcher() {

            @Override
            public String description() {
                return description;
            }

            @Override
            public MatchResult evaluate() {
                return condition.getAsBoolean()
                        ? new MatchResult.Matched(description)
                        : new MatchResult.NotMatched(description);
            }

        };
    }

    /**
     * @param description Description of the condition
     * @param reason      Why the condition can not be evaluated
     * @return A {@link Matcher} that always fails
     */
    public static Matcher failed(final String description, final String reason) {
        requireNonNull(description, "description must not be null");
        requireNonNull(reason, "reason must not be null");

        return new Matcher() {

            @Override
            public String description() {
                return description;
            }

            @Override
            public MatchResult evaluate() {
                return new MatchResult.Failed(description, reason);
            }

        };
    }

    public static Matcher allOf(final Matcher... matchers) {
        return allOf(List.of(matchers));
    }

    /**
     * @param matchers The {@link Matcher}s to combine
     * @return A {@link Matcher} that matches when all {@code matchers} match, or when there are none
     */
    public static Matcher allOf(final List<Matcher> matchers) {
        final List<Matcher> operands = List.copyOf(matchers);
        final String description = describe(operands, " AND ");

        return new Matcher() {

            @Override
            public String description() {
                return description;
            }

            @Override
            public MatchResult evaluate() {
                for (final Matcher operand : operands) {
                    final MatchResult result = operand.evaluate();
                    if (!result.isMatched()) {
                        return result;
                    }
                }

                return new MatchResult.Matched(description);
            }

        };
    }

    public static Matcher anyOf(final Matcher... matchers) {
        return anyOf(List.of(matchers));
    }

    /**
     * @param matchers The {@link Matcher}s to combine
     * @return A {@link Matcher} that matches when at least one of {@code matchers} matches
     */
    public static Matcher anyOf(final List<Matcher> matchers) {
        final List<Matcher> operands = List.copyOf(matchers);
        final String description = describe(operands, " OR ");

        return new Matcher() {

            @Override
            public String description() {
                return description;
            }

            @Override
            public MatchResult evaluate() {
                for (final Matcher operand : operands) {
                    final MatchResult result = operand.evaluate();
                    if (!(result instanceof MatchResult.NotMatched)) {
                        return result;
                    }
                }

                return new MatchResult.NotMatched(description);
            }

        };
    }

    public static Matcher not(final Matcher matcher) {
        requireNonNull(matcher, "matcher must not be null");
        final String description = "NOT " + matcher.description();

        return new Matcher() {

            @Override
            public String description() {
                return description;
            }

            @Override
            public MatchResult evaluate() {
                final MatchResult result = matcher.evaluate();
                if (result instanceof final MatchResult.Failed failed) {
                    return failed;
                }

                return result.isMatched()
                        ? new MatchResult.NotMatched(description)
                        : new MatchResult.Matched(description);
            }

        };
    }

    private static String describe(final List<Matcher> operands, final String delimiter) {
        if (operands.size() == 1) {
            return operands.get(0).description();
        }

        return operands.stream()
                .map(Matcher::description)
                .collect(Collectors.joining(delimiter, "(", ")"));
    }

}
