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
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A software project whose dependencies were analyzed.
 *
 * @param id                 Coordinates of the project
 * @param definitionFilePath Path of the manifest the project was defined in, if known
 * @param declaredLicenses   Licenses declared in the project's manifest
 * @param vcs                Where the sources of the project are maintained
 * @param scopes             Dependency scopes of the project, in manifest order
 * @since 1.0.0
 */
public record Project(
        Identifier id,
        @Nullable String definitionFilePath,
        Set<String> declaredLicenses,
        VcsInfo vcs,
        List<Scope> scopes) {

    public Project {
        requireNonNull(id, "id must not be null");
        requireNonNull(declaredLicenses, "declaredLicenses must not be null");
        requireNonNull(vcs, "vcs must not be null");
        declaredLicenses = Collections.unmodifiableSet(new LinkedHashSet<>(declaredLicenses));
        scopes = List.copyOf(requireNonNull(scopes, "scopes must not be null"));
    }

    public Project(final Identifier id, final List<Scope> scopes) {
        this(id, null, Set.of(), VcsInfo.EMPTY, scopes);
    }

    /**
     * @return A {@link Package} representation of this project, for when it is depended upon by another project
     */
    public Package toPackage() {
        return new Package(id, declaredLicenses, null, RemoteArtifact.EMPTY, RemoteArtifact.EMPTY, vcs);
    }

}
