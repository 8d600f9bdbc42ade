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
package org.dependencytrack.compliance.evaluator;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of {@link Evaluator#evaluate(List)}.
 *
 * @param startTime  When the evaluation started
 * @param endTime    When the evaluation completed
 * @param violations The {@link Violation}s, in evaluation order
 * @param failures   The {@link EvaluationFailure}s, in evaluation order
 * @since 1.0.0
 */
public record EvaluatorRun(
        Instant startTime,
        Instant endTime,
        List<Violation> violations,
        List<EvaluationFailure> failures) {

    public EvaluatorRun {
        requireNonNull(startTime, "startTime must not be null");
        requireNonNull(endTime, "endTime must not be null");
        violations = List.copyOf(requireNonNull(violations, "violations must not be null"));
        failures = List.copyOf(requireNonNull(failures, "failures must not be null"));
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime must not be before startTime");
        }
    }

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }

    public List<Violation> getViolations(final Violation.Severity severity) {
        return violations.stream()
                .filter(violation -> violation.severity() == severity)
                .toList();
    }

    /**
     * @param severity The {@link Violation.Severity} to check for
     * @return {@code true} when at least one violation of {@code severity} was raised
     */
    public boolean hasViolations(final Violation.Severity severity) {
        return violations.stream().anyMatch(violation -> violation.severity() == severity);
    }

}
