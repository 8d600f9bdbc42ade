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

import org.dependencytrack.compliance.model.LicenseFinding;
import org.dependencytrack.compliance.model.LicenseSource;
import org.dependencytrack.compliance.model.Package;
import org.dependencytrack.compliance.spdx.expression.SpdxExpression;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A view on the licenses of a {@link Package}, defining which {@link LicenseSource}s are taken
 * into account, and how they take precedence over each other.
 * <p>
 * A concluded license is only considered present if it is a valid SPDX expression. Compound
 * concluded licenses are decomposed into their individual license identifiers.
 *
 * @since 1.0.0
 */
public enum LicenseView {

    /**
     * All licenses of all sources.
     */
    ALL,

    /**
     * The concluded license if present, otherwise the declared and detected licenses.
     */
    CONCLUDED_OR_REST,

    /**
     * The concluded license if present, otherwise the declared licenses if present,
     * otherwise the detected licenses.
     */
    CONCLUDED_OR_DECLARED_OR_DETECTED,

    /**
     * The concluded license if present, otherwise the detected licenses.
     * Declared licenses are never considered.
     */
    CONCLUDED_OR_DETECTED,

    ONLY_CONCLUDED,

    ONLY_DECLARED,

    ONLY_DETECTED;

    /**
     * Resolve a {@link LicenseView} by name.
     * <p>
     * Names are matched case-insensitively, and {@code -} is treated like {@code _}.
     *
     * @param name Name of the view, e.g. {@code concluded-or-rest}
     * @return The {@link LicenseView}
     * @throws IllegalArgumentException When no view with the given name exists
     */
    public static LicenseView of(final String name) {
        requireNonNull(name, "name must not be null");

        final String normalizedName = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (final LicenseView view : values()) {
            if (view.name().equals(normalizedName)) {
                return view;
            }
        }

        throw new IllegalArgumentException("Unknown license view: " + name);
    }

    /**
     * Get the licenses of a {@link Package}, as seen through this view.
     * <p>
     * Malformed concluded licenses are logged at {@code WARN} level.
     * Use a {@link LicenseResolver} to customize this behavior, or to avoid re-parsing
     * the concluded license on every call.
     *
     * @param pkg              The {@link Package} to get licenses for
     * @param detectedLicenses The {@link LicenseFinding}s detected for the package
     * @return The licenses of the package, without duplicates
     */
    public Set<ResolvedLicense> licenses(final Package pkg, final Collection<LicenseFinding> detectedLicenses) {
        return new LicenseResolver(true).resolveLicenses(this, pkg, detectedLicenses);
    }

    Set<ResolvedLicense> resolve(
            final @Nullable SpdxExpression concludedLicense,
            final Set<String> declaredLicenses,
            final Collection<LicenseFinding> detectedLicenses) {
        final var licenses = new LinkedHashSet<ResolvedLicense>();

        switch (this) {
            case ALL -> {
                addConcluded(licenses, concludedLicense);
                addDeclared(licenses, declaredLicenses);
                addDetected(licenses, detectedLicenses);
            }
            case CONCLUDED_OR_REST -> {
                if (concludedLicense != null) {
                    addConcluded(licenses, concludedLicense);
                } else {
                    addDeclared(licenses, declaredLicenses);
                    addDetected(licenses, detectedLicenses);
                }
            }
            case CONCLUDED_OR_DECLARED_OR_DETECTED -> {
                if (concludedLicense != null) {
                    addConcluded(licenses, concludedLicense);
                } else if (hasAny(declaredLicenses)) {
                    addDeclared(licenses, declaredLicenses);
                } else {
                    addDetected(licenses, detectedLicenses);
                }
            }
            case CONCLUDED_OR_DETECTED -> {
                if (concludedLicense != null) {
                    addConcluded(licenses, concludedLicense);
                } else {
                    addDetected(licenses, detectedLicenses);
                }
            }
            case ONLY_CONCLUDED -> addConcluded(licenses, concludedLicense);
            case ONLY_DECLARED -> addDeclared(licenses, declaredLicenses);
            case ONLY_DETECTED -> addDetected(licenses, detectedLicenses);
        }

        return Collections.unmodifiableSet(licenses);
    }

    private static void addConcluded(final Set<ResolvedLicense> licenses, final @Nullable SpdxExpression concludedLicense) {
        if (concludedLicense == null) {
            return;
        }

        for (final String license : concludedLicense.licenses()) {
            add(licenses, license, LicenseSource.CONCLUDED);
        }
    }

    private static void addDeclared(final Set<ResolvedLicense> licenses, final Set<String> declaredLicenses) {
        for (final String license : declaredLicenses) {
            add(licenses, license, LicenseSource.DECLARED);
        }
    }

    private static void addDetected(final Set<ResolvedLicense> licenses, final Collection<LicenseFinding> detectedLicenses) {
        for (final LicenseFinding finding : detectedLicenses) {
            add(licenses, finding.license(), LicenseSource.DETECTED);
        }
    }

    private static void add(final Set<ResolvedLicense> licenses, final @Nullable String license, final LicenseSource source) {
        if (license != null && !license.isBlank()) {
            licenses.add(new ResolvedLicense(license.trim(), source));
        }
    }

    private static boolean hasAny(final Set<String> licenses) {
        for (final String license : licenses) {
            if (license != null && !license.isBlank()) {
                return true;
            }
        }

        return false;
    }

}
