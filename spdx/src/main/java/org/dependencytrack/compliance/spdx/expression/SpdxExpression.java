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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A parsed SPDX license expression.
 * <p>
 * Expressions are immutable trees. Leaves are always {@link SpdxLicenseIdExpression}s,
 * optionally wrapped in a {@link SpdxLicenseWithExceptionExpression}.
 *
 * @see <a href="https://spdx.github.io/spdx-spec/v2.3/SPDX-license-expressions/">SPDX License Expressions</a>
 * @since 1.0.0
 */
public sealed interface SpdxExpression
        permits SpdxCompoundExpression, SpdxLicenseIdExpression, SpdxLicenseWithExceptionExpression {

    /**
     * Decompose this expression into the license identifiers it is made of.
     * <p>
     * The exceptions of {@code WITH} expressions are not licenses and are thus not included.
     *
     * @return The leaf license identifiers, in the order they appear in the expression
     */
    Set<SpdxLicenseIdExpression> decompose();

    /**
     * @return The {@link String} representations of {@link #decompose()}
     */
    default Set<String> licenses() {
        final var licenses = new LinkedHashSet<String>();
        for (final SpdxLicenseIdExpression license : decompose()) {
            licenses.add(license.toString());
        }

        return licenses;
    }

}
