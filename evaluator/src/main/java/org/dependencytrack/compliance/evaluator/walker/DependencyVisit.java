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
package org.dependencytrack.compliance.evaluator.walker;

import org.dependencytrack.compliance.model.Package;
import org.dependencytrack.compliance.model.PackageReference;
import org.dependencytrack.compliance.model.Project;
import org.dependencytrack.compliance.model.Scope;
import org.jspecify.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A node of a dependency tree, as visited by the {@link DependencyTreeWalker}.
 *
 * @param project    The project the dependency tree belongs to, if any
 * @param scope      The scope the dependency tree belongs to
 * @param dependency The edge through which the node was reached
 * @param pkg        The package the node refers to
 * @param ancestors  The packages on the path from the scope root down to, but excluding, this node
 * @param level      The level of the node in the tree, where direct dependencies of the scope are at level 0
 * @since 1.0.0
 */
public record DependencyVisit(
        @Nullable Project project,
        Scope scope,
        PackageReference dependency,
        Package pkg,
        List<Package> ancestors,
        int level) {

    public DependencyVisit {
        requireNonNull(scope, "scope must not be null");
        requireNonNull(dependency, "dependency must not be null");
        requireNonNull(pkg, "pkg must not be null");
        ancestors = List.copyOf(requireNonNull(ancestors, "ancestors must not be null"));
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative, but is " + level);
        }
    }

}
