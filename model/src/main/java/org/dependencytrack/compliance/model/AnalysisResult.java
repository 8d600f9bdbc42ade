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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The fully resolved result of analyzing one or more {@link Project}s: the projects with their
 * dependency trees, the metadata of all referenced {@link Package}s, the {@link PackageCuration}s
 * to apply to them, and the {@link ScopeExclude}s configured for the projects.
 * <p>
 * The result is an immutable snapshot. Curations are applied on construction.
 *
 * @since 1.0.0
 */
public final class AnalysisResult {

    private final List<Project> projects;
    private final Map<Identifier, Project> projectsById;
    private final Map<Identifier, Package> packagesById;
    private final List<PackageCuration> curations;
    private final List<ScopeExclude> scopeExcludes;
    private final int maxTreeDepth;

    public AnalysisResult(
            final List<Project> projects,
            final Collection<Package> packages,
            final List<PackageCuration> curations,
            final List<ScopeExclude> scopeExcludes) {
        this.projects = List.copyOf(requireNonNull(projects, "projects must not be null"));
        this.curations = List.copyOf(requireNonNull(curations, "curations must not be null"));
        this.scopeExcludes = List.copyOf(requireNonNull(scopeExcludes, "scopeExcludes must not be null"));
        requireNonNull(packages, "packages must not be null");

        final var projectsById = new LinkedHashMap<Identifier, Project>();
        int maxTreeDepth = 0;
        for (final Project project : this.projects) {
            if (projectsById.putIfAbsent(project.id(), project) != null) {
                throw new IllegalArgumentException("Duplicate project: " + project.id());
            }
            for (final Scope scope : project.scopes()) {
                maxTreeDepth = Math.max(maxTreeDepth, scope.depth());
            }
        }

        final var packagesById = new LinkedHashMap<Identifier, Package>();
        for (final Package pkg : packages) {
            if (packagesById.putIfAbsent(pkg.id(), curate(pkg)) != null) {
                throw new IllegalArgumentException("Duplicate package: " + pkg.id());
            }
        }

        this.projectsById = Collections.unmodifiableMap(projectsById);
        this.packagesById = Collections.unmodifiableMap(packagesById);
        this.maxTreeDepth = maxTreeDepth;
    }

    public AnalysisResult(final List<Project> projects, final Collection<Package> packages) {
        this(projects, packages, List.of(), List.of());
    }

    public List<Project> getProjects() {
        return projects;
    }

    public Optional<Project> getProject(final Identifier id) {
        return Optional.ofNullable(projectsById.get(id));
    }

    public boolean isProject(final Identifier id) {
        return projectsById.containsKey(id);
    }

    /**
     * @return All packages, with curations applied
     */
    public Collection<Package> getPackages() {
        return packagesById.values();
    }

    /**
     * @param id The {@link Identifier} of the package
     * @return The package with curations applied, or {@link Optional#empty()} if the package is unknown
     */
    public Optional<Package> getPackage(final Identifier id) {
        return Optional.ofNullable(packagesById.get(id));
    }

    /**
     * Resolve the {@link Package} that a node in a dependency tree refers to.
     * <p>
     * Projects may depend on other projects, in which case the package is derived from the project.
     * References to packages that are not part of this result yield an empty package,
     * with applicable curations applied.
     *
     * @param id The {@link Identifier} of the package
     * @return The resolved {@link Package}
     */
    public Package resolvePackage(final Identifier id) {
        final Project project = projectsById.get(id);
        if (project != null) {
            return project.toPackage();
        }

        final Package pkg = packagesById.get(id);
        return pkg != null ? pkg : curate(Package.empty(id));
    }

    public List<PackageCuration> getCurations(final Identifier id) {
        final var applicableCurations = new ArrayList<PackageCuration>();
        for (final PackageCuration curation : curations) {
            if (curation.isApplicableTo(id)) {
                applicableCurations.add(curation);
            }
        }

        return applicableCurations;
    }

    public List<ScopeExclude> getScopeExcludes() {
        return scopeExcludes;
    }

    public boolean isExcluded(final Scope scope) {
        for (final ScopeExclude scopeExclude : scopeExcludes) {
            if (scopeExclude.matches(scope.name())) {
                return true;
            }
        }

        return false;
    }

    /**
     * @return The number of levels of the deepest dependency tree across all projects and scopes
     */
    public int getMaxTreeDepth() {
        return maxTreeDepth;
    }

    private Package curate(final Package pkg) {
        Package curatedPackage = pkg;
        for (final PackageCuration curation : getCurations(pkg.id())) {
            curatedPackage = curatedPackage.curate(curation);
        }

        return curatedPackage;
    }

}
