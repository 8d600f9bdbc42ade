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

import org.dependencytrack.compliance.evaluator.matcher.MatcherFactory;
import org.jspecify.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A named condition that is evaluated on every node of every dependency tree.
 * <p>
 * {@code message} and {@code howToFix} are templates that may reference the placeholders
 * {@code ${rule}}, {@code ${package}}, {@code ${license}}, {@code ${licenseSource}},
 * {@code ${scope}}, {@code ${project}} and {@code ${level}}.
 *
 * @param name         Name of the rule
 * @param condition    Creates the condition for a given {@link DependencyRule} context
 * @param polarity     Whether the rule flags when its condition matches, or when it does not
 * @param severity     {@link Violation.Severity} of the violations the rule produces
 * @param message      Message template of the violations
 * @param howToFix     How-to-fix template of the violations
 * @param licenseViews The {@link LicenseView}s to evaluate the rule with.
 *                     When empty, the configured default view is used
 * @param perLicense   Whether the rule is evaluated once for every license of a package
 * @since 1.0.0
 */
public record Rule(
        String name,
        MatcherFactory condition,
        Polarity polarity,
        Violation.Severity severity,
        String message,
        @Nullable String howToFix,
        List<LicenseView> licenseViews,
        boolean perLicense) {

    public enum Polarity {

        /**
         * A violation is raised when the condition matches.
         */
        FLAG_IF_MATCHED,

        /**
         * A violation is raised when the condition does not match.
         */
        REQUIRE

    }

    public Rule {
        requireNonNull(name, "name must not be null");
        requireNonNull(condition, "condition must not be null");
        requireNonNull(polarity, "polarity must not be null");
        requireNonNull(severity, "severity must not be null");
        requireNonNull(message, "message must not be null");
        licenseViews = List.copyOf(requireNonNull(licenseViews, "licenseViews must not be null"));
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public Rule(
            final String name,
            final MatcherFactory condition,
            final Polarity polarity,
            final Violation.Severity severity,
            final String message) {
        this(name, condition, polarity, severity, message, null, List.of(), false);
    }

    public Rule withHowToFix(final @Nullable String howToFix) {
        return new Rule(name, condition, polarity, severity, message, howToFix, licenseViews, perLicense);
    }

    public Rule withLicenseViews(final List<LicenseView> licenseViews) {
        return new Rule(name, condition, polarity, severity, message, howToFix, licenseViews, perLicense);
    }

    public Rule withPerLicense(final boolean perLicense) {
        return new Rule(name, condition, polarity, severity, message, howToFix, licenseViews, perLicense);
    }

}
