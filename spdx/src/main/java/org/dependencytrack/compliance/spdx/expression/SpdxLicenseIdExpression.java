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
 * A single license identifier, e.g. {@code MIT} or {@code LicenseRef-acme}.
 * <p>
 * Current SPDX identifiers carry the "or later version" semantic in the identifier itself
 * ({@code GPL-2.0-or-later}), whereas deprecated identifiers use a generic {@code +} suffix
 * ({@code GPL-2.0+}). In the latter case, {@link #id()} holds the identifier without the suffix,
 * and {@link #orLaterVersion()} is {@code true}.
 *
 * @param id             The license identifier
 * @param orLaterVersion Whether later versions of the license may be used
 * @since 1.0.0
 */
public record SpdxLicenseIdExpression(String id, boolean orLaterVersion) implements SpdxExpression {

    private static final String OR_LATER_SUFFIX = "-or-later";

    public SpdxLicenseIdExpression {
        requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (id.endsWith("+")) {
            throw new IllegalArgumentException("id must not end with '+', use orLaterVersion instead: " + id);
        }
    }

    /**
     * Create a {@link SpdxLicenseIdExpression} from a raw identifier token.
     *
     * @param token The identifier as it appears in an expression, e.g. {@code GPL-2.0+}
     * @return The normalized {@link SpdxLicenseIdExpression}
     */
    public static SpdxLicenseIdExpression of(final String token) {
        requireNonNull(token, "token must not be null");
        if (token.endsWith("+")) {
            return new SpdxLicenseIdExpression(token.substring(0, token.length() - 1), true);
        }

        return new SpdxLicenseIdExpression(token, token.endsWith(OR_LATER_SUFFIX));
    }

    @Override
    public Set<SpdxLicenseIdExpression> decompose() {
        return Set.of(this);
    }

    @Override
    public String toString() {
        return orLaterVersion && !id.endsWith(OR_LATER_SUFFIX) ? id + "+" : id;
    }

}
