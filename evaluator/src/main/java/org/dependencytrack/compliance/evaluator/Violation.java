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

import org.dependencytrack.compliance.model.Identifier;
import org.dependencytrack.compliance.model.LicenseSource;
import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A violation of a {@link Rule}, raised for a single node of a dependency tree.
 *
 * @param ruleName      Name of the violated rule
 * @param packageId     {@link Identifier} of the offending package
 * @param license       The license the violation refers to, if any
 * @param licenseSource {@link LicenseSource} of {@code license}, if any
 * @param severity      The {@link Severity} of the violation
 * @param message       The rendered message
 * @param howToFix      The rendered how-to-fix text, if any
 * @param projectId     {@link Identifier} of the project the package is a dependency of, if any
 * @param scopeName     Name of the scope the package is a dependency in
 * @param level         Level of the package in the dependency tree
 * @param licenseView   The {@link LicenseView} the rule was evaluated with
 * @since 1.0.0
 */
public record Violation(
        String ruleName,
        Identifier packageId,
        @Nullable String license,
        @Nullable LicenseSource licenseSource,
        Severity severity,
        String message,
        @Nullable String howToFix,
        @Nullable Identifier projectId,
        String scopeName,
        int level,
        LicenseView licenseView) {

    public enum Severity {

        FAIL,

        WARN,

        INFO

    }

    public Violation {
        requireNonNull(ruleName, "ruleName must not be null");
        requireNonNull(packageId, "packageId must not be null");
        requireNonNull(severity, "severity must not be null");
        requireNonNull(message, "message must not be null");
        requireNonNull(scopeName, "scopeName must not be null");
        requireNonNull(licenseView, "licenseView must not be null");
    }

}
