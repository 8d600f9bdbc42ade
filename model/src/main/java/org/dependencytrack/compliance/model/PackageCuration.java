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
package org.dependencytrack.compliance.model;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A manual correction of the metadata of a {@link Package}.
 * <p>
 * A curation whose {@link Identifier} has no version applies to all versions of the package.
 *
 * @param id               Coordinates of the curated package
 * @param concludedLicense Replacement for the concluded license, if any
 * @param declaredLicenses Replacement for the declared licenses, if any
 * @param comment          Why the curation was made
 * @since 1.0.0
 */
public record PackageCuration(
        Identifier id,
        @Nullable String concludedLicense,
        @Nullable Set<String> declaredLicenses,
        @Nullable String comment) {

    public PackageCuration {
        requireNonNull(id, "id must not be null");
        if (declaredLicenses != null) {
            declaredLicenses = Collections.unmodifiableSet(new LinkedHashSet<>(declaredLicenses));
        }
    }

    public boolean isApplicableTo(final Identifier packageId) {
        return id.type().equals(packageId.type())
                && Objects.equals(id.namespace(), packageId.namespace())
                && id.name().equals(packageId.name())
                && (id.version() == null || id.version().equals(packageId.version()));
    }

}
