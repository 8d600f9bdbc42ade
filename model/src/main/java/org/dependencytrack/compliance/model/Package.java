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

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A software package as determined by analyzing a package manager's metadata.
 *
 * @param id               Coordinates of the package
 * @param declaredLicenses Licenses as declared in the package's metadata, in declaration order
 * @param concludedLicense The concluded license, as SPDX expression, if any
 * @param binaryArtifact   The binary artifact of the package
 * @param sourceArtifact   The source artifact of the package
 * @param vcs              Where the sources of the package are maintained
 * @since 1.0.0
 */
public record Package(
        Identifier id,
        Set<String> declaredLicenses,
        @Nullable String concludedLicense,
        RemoteArtifact binaryArtifact,
        RemoteArtifact sourceArtifact,
        VcsInfo vcs) {

    public Package {
        requireNonNull(id, "id must not be null");
        requireNonNull(declaredLicenses, "declaredLicenses must not be null");
        requireNonNull(binaryArtifact, "binaryArtifact must not be null");
        requireNonNull(sourceArtifact, "sourceArtifact must not be null");
        requireNonNull(vcs, "vcs must not be null");
        declaredLicenses = Collections.unmodifiableSet(new LinkedHashSet<>(declaredLicenses));
        concludedLicense = StringUtils.trimToNull(concludedLicense);
    }

    public Package(final Identifier id, final Set<String> declaredLicenses, final @Nullable String concludedLicense) {
        this(id, declaredLicenses, concludedLicense, RemoteArtifact.EMPTY, RemoteArtifact.EMPTY, VcsInfo.EMPTY);
    }

    /**
     * @param id Coordinates of the package
     * @return A {@link Package} without any metadata besides its {@link Identifier}
     */
    public static Package empty(final Identifier id) {
        return new Package(id, Set.of(), null);
    }

    /**
     * Apply a {@link PackageCuration} to this package.
     * <p>
     * Values of the curation that are {@code null} leave the corresponding value of the package untouched.
     *
     * @param curation The {@link PackageCuration} to apply
     * @return The curated {@link Package}
     * @throws IllegalArgumentException When the curation is not applicable to this package
     */
    public Package curate(final PackageCuration curation) {
        requireNonNull(curation, "curation must not be null");
        if (!curation.isApplicableTo(id)) {
            throw new IllegalArgumentException("Curation for %s is not applicable to %s".formatted(curation.id(), id));
        }

        return new Package(
                id,
                curation.declaredLicenses() != null ? curation.declaredLicenses() : declaredLicenses,
                curation.concludedLicense() != null ? curation.concludedLicense() : concludedLicense,
                binaryArtifact,
                sourceArtifact,
                vcs);
    }

}
