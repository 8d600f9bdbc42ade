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

import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A license with an exception, e.g. {@code GPL-2.0-only WITH Classpath-exception-2.0}.
 *
 * @param license   The license the exception applies to
 * @param exception The exception identifier
 * @since 1.0.0
 */
public record SpdxLicenseWithExceptionExpression(
        SpdxLicenseIdExpression license,
        String exception) implements SpdxExpression {

    public SpdxLicenseWithExceptionExpression {
        requireNonNull(license, "license must not be null");
        requireNonNull(exception, "exception must not be null");
    }

    @Override
    public Set<SpdxLicenseIdExpression> decompose() {
        return license.decompose();
    }

    @Override
    public String toString() {
        return license + " WITH " + exception;
    }

}
