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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A named group of dependencies of a {@link Project}, e.g. {@code compile} or {@code test}.
 *
 * @param name         Name of the scope
 * @param dependencies Direct dependencies of the scope, i.e. the roots of its dependency trees
 * @since 1.0.0
 */
public record Scope(String name, List<PackageReference> dependencies) {

    public Scope {
        requireNonNull(name, "name must not be null");
        dependencies = List.copyOf(requireNonNull(dependencies, "dependencies must not be null"));
    }

    /**
     * @return Number of levels of the dependency trees in this scope
     */
    public int depth() {
        int depth = 0;
        for (final PackageReference dependency : dependencies) {
            depth = Math.max(depth, dependency.getDepth());
        }

        return depth;
    }

}
