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

import static java.util.Objects.requireNonNull;

/**
 * Origin of the source code a {@link LicenseFinding} was detected in.
 *
 * @since 1.0.0
 */
public sealed interface Provenance {

    Provenance UNKNOWN = new UnknownProvenance();

    /**
     * The scanned code was obtained from a downloaded artifact.
     */
    record ArtifactProvenance(RemoteArtifact sourceArtifact) implements Provenance {

        public ArtifactProvenance {
            requireNonNull(sourceArtifact, "sourceArtifact must not be null");
        }

    }

    /**
     * The scanned code was obtained from a VCS checkout.
     *
     * @param vcsInfo          The VCS location as declared by the package
     * @param resolvedRevision The revision that was actually checked out
     */
    record RepositoryProvenance(VcsInfo vcsInfo, String resolvedRevision) implements Provenance {

        public RepositoryProvenance {
            requireNonNull(vcsInfo, "vcsInfo must not be null");
            requireNonNull(resolvedRevision, "resolvedRevision must not be null");
        }

    }

    record UnknownProvenance() implements Provenance {
    }

}
