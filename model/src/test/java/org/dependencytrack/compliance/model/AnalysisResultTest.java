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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class AnalysisResultTest {

    private static final Identifier PROJECT_ID = Identifier.of("pkg:maven/org.acme/acme-app@1.0.0");
    private static final Identifier LIB_ID = Identifier.of("pkg:maven/org.acme/acme-lib@2.0.0");
    private static final Identifier UTIL_ID = Identifier.of("pkg:maven/org.acme/acme-util@3.0.0");

    @Nested
    class ConstructionTest {

        @Test
        void shouldThrowOnDuplicateProjects() {
            final var project = new Project(PROJECT_ID, List.of());

            assertThatExceptionOfType(IllegalArgumentException.class)
                    .isThrownBy(() -> new AnalysisResult(List.of(project, project), List.of()))
                    .withMessage("Duplicate project: pkg:maven/org.acme/acme-app@1.0.0");
        }

        @Test
        void shouldThrowOnDuplicatePackages() {
            final Package pkg = Package.empty(LIB_ID);

            assertThatExceptionOfType(IllegalArgumentException.class)
                    .isThrownBy(() -> new AnalysisResult(List.of(), List.of(pkg, pkg)))
                    .withMessage("Duplicate package: pkg:maven/org.acme/acme-lib@2.0.0");
        }

        @Test
        void shouldThrowOnDuplicatePackagesWithDifferentlyCasedType() {
            final Package pkg = Package.empty(LIB_ID);
            final Package samePkg = Package.empty(new Identifier("Maven", "org.acme", "acme-lib", "2.0.0"));

            assertThatExceptionOfType(IllegalArgumentException.class)
                    .isThrownBy(() -> new AnalysisResult(List.of(), List.of(pkg, samePkg)))
                    .withMessage("Duplicate package: pkg:maven/org.acme/acme-lib@2.0.0");
        }

        @Test
        void shouldComputeMaxTreeDepth() {
            final var chain = new PackageReference(LIB_ID, List.of(
                    new PackageReference(UTIL_ID, List.of(
                            new PackageReference(LIB_ID)))));
            final var project = new Project(PROJECT_ID, List.of(
                    new Scope("compile", List.of(chain)),
                    new Scope("test", List.of(new PackageReference(UTIL_ID)))));

            final var result = new AnalysisResult(List.of(project), List.of());

            assertThat(chain.getDepth()).isEqualTo(3);
            assertThat(result.getMaxTreeDepth()).isEqualTo(3);
        }

    }

    @Nested
    class CurationTest {

        @Test
        void shouldApplyCurationsToPackages() {
            final var pkg = new Package(LIB_ID, Set.of("Apache-2.0"), null);
            final var curation = new PackageCuration(LIB_ID, "MIT OR Apache-2.0", null, "Dual licensed");

            final var result = new AnalysisResult(List.of(), List.of(pkg), List.of(curation), List.of());

            assertThat(result.getPackage(LIB_ID)).hasValueSatisfying(curatedPkg -> {
                assertThat(curatedPkg.concludedLicense()).isEqualTo("MIT OR Apache-2.0");
                assertThat(curatedPkg.declaredLicenses()).containsExactly("Apache-2.0");
            });
            assertThat(result.getCurations(LIB_ID)).containsExactly(curation);
        }

        @Test
        void shouldApplyVersionlessCurationsToAllVersions() {
            final var curation = new PackageCuration(
                    new Identifier("maven", "org.acme", "acme-lib", null), null, Set.of("BSD-3-Clause"), null);

            final var result = new AnalysisResult(
                    List.of(), List.of(Package.empty(LIB_ID)), List.of(curation), List.of());

            assertThat(result.resolvePackage(LIB_ID).declaredLicenses()).containsExactly("BSD-3-Clause");
            assertThat(result.getCurations(UTIL_ID)).isEmpty();
        }

        @Test
        void shouldApplyLaterCurationsOnTopOfEarlierOnes() {
            final var first = new PackageCuration(LIB_ID, "MIT", Set.of("MIT"), null);
            final var second = new PackageCuration(LIB_ID, "Apache-2.0", null, null);

            final var result = new AnalysisResult(
                    List.of(), List.of(Package.empty(LIB_ID)), List.of(first, second), List.of());

            assertThat(result.resolvePackage(LIB_ID).concludedLicense()).isEqualTo("Apache-2.0");
            assertThat(result.resolvePackage(LIB_ID).declaredLicenses()).containsExactly("MIT");
        }

    }

    @Nested
    class ResolvePackageTest {

        @Test
        void shouldResolveProjectsAsPackages() {
            final var project = new Project(PROJECT_ID, null, Set.of("MIT"), VcsInfo.EMPTY, List.of());

            final var result = new AnalysisResult(List.of(project), List.of());

            assertThat(result.isProject(PROJECT_ID)).isTrue();
            assertThat(result.resolvePackage(PROJECT_ID).declaredLicenses()).containsExactly("MIT");
        }

        @Test
        void shouldResolveUnknownPackagesAsEmpty() {
            final var result = new AnalysisResult(List.of(), List.of());

            assertThat(result.getPackage(UTIL_ID)).isEmpty();
            assertThat(result.resolvePackage(UTIL_ID)).isEqualTo(Package.empty(UTIL_ID));
        }

    }

    @Test
    void shouldExcludeMatchingScopes() {
        final var scopeExclude = new ScopeExclude("test.*", ScopeExclude.Reason.TEST_DEPENDENCY_OF, null);

        final var result = new AnalysisResult(List.of(), List.of(), List.of(), List.of(scopeExclude));

        assertThat(result.getScopeExcludes()).containsExactly(scopeExclude);
        assertThat(result.isExcluded(new Scope("testCompile", List.of()))).isTrue();
        assertThat(result.isExcluded(new Scope("compile", List.of()))).isFalse();
    }

}
