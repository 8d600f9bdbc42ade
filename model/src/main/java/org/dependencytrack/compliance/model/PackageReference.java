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
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * An edge in a dependency tree: a reference to the {@link Package} identified by {@link #getId()},
 * together with the dependencies of that package.
 * <p>
 * References are immutable and can only be composed from already existing references,
 * so a dependency tree never contains back-edges. The same package may however appear
 * at multiple positions in the tree. The depth of the subtree is computed on construction.
 *
 * @since 1.0.0
 */
public final class PackageReference {

    private final Identifier id;
    private final Linkage linkage;
    private final List<PackageReference> dependencies;
    private final int depth;

    public PackageReference(final Identifier id, final Linkage linkage, final List<PackageReference> dependencies) {
        this.id = requireNonNull(id, "id must not be null");
        this.linkage = requireNonNull(linkage, "linkage must not be null");
        this.dependencies = List.copyOf(requireNonNull(dependencies, "dependencies must not be null"));

        int maxChildDepth = 0;
        for (final PackageReference dependency : this.dependencies) {
            maxChildDepth = Math.max(maxChildDepth, dependency.depth);
        }
        this.depth = maxChildDepth + 1;
    }

    public PackageReference(final Identifier id, final List<PackageReference> dependencies) {
        this(id, Linkage.DYNAMIC, dependencies);
    }

    public PackageReference(final Identifier id) {
        this(id, Linkage.DYNAMIC, List.of());
    }

    public Identifier getId() {
        return id;
    }

    public Linkage getLinkage() {
        return linkage;
    }

    public List<PackageReference> getDependencies() {
        return dependencies;
    }

    /**
     * @return Number of levels of the subtree rooted at this reference, including this reference itself
     */
    public int getDepth() {
        return depth;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final PackageReference that)) {
            return false;
        }

        return id.equals(that.id)
                && linkage == that.linkage
                && dependencies.equals(that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, linkage, dependencies);
    }

    @Override
    public String toString() {
        return "PackageReference{id=%s, linkage=%s, dependencies=%d}".formatted(id, linkage, dependencies.size());
    }

}
