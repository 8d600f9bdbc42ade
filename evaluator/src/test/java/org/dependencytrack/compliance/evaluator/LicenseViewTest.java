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
package org.dependencytrack.compliance.evaluator;

import org.dependencytrack.compliance.model.Identifier;
import org.dependencytrack.compliance.model.LicenseFinding;
import org.dependencytrack.compliance.model.LicenseSource;
import org.dependencytrack.compliance.model.Package;
import org.dependencytrack.compliance.model.TextLocation;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.dependencytrack.compliance.model.LicenseSource.CONCLUDED;
import static org.dependencytrack.compliance.model.LicenseSource.DECLARED;
import static org.dependencytrack.compliance.model.LicenseSource.DETECTED;

class LicenseViewTest {

    private static final Identifier PACKAGE_ID = Identifier.of("pkg:maven/org.acme/acme-lib@1.0.0");

    private static final Package PACKAGE_WITHOUT_LICENSE = Package.empty(PACKAGE_ID);
    private static final Package PACKAGE_WITH_ONLY_CONCLUDED_LICENSE =
            new Package(PACKAGE_ID, Set.of(), "LicenseRef-a AND LicenseRef-b");
    private static final Package PACKAGE_WITH_ONLY_DECLARED_LICENSE =
            new Package(PACKAGE_ID, new LinkedHashSet<>(List.of("Apache-2.0", "MIT")), null);
    private static final Package PACKAGE_WITH_CONCLUDED_AND_DECLARED_LICENSE =
            new Package(PACKAGE_ID, new LinkedHashSet<>(List.of("Apache-2.0", "MIT")), "LicenseRef-a AND LicenseRef-b");

    private static final List<LicenseFinding> DETECTED_LICENSES = List.of(
            new LicenseFinding("LicenseRef-a", new TextLocation("LICENSE-a.txt", 1, 1)),
            new LicenseFinding("LicenseRef-b", new TextLocation("LICENSE-b.txt", 1, 1)));

    private static ResolvedLicense license(final String license, final LicenseSource source) {
        return new ResolvedLicense(license, source);
    }

    private static final ResolvedLicense CONCLUDED_A = license("LicenseRef-a", CONCLUDED);
    private static final ResolvedLicense CONCLUDED_B = license("LicenseRef-b", CONCLUDED);
    private static final ResolvedLicense DECLARED_APACHE = license("Apache-2.0", DECLARED);
    private static final ResolvedLicense DECLARED_MIT = license("MIT", DECLARED);
    private static final ResolvedLicense DETECTED_A = license("LicenseRef-a", DETECTED);
    private static final ResolvedLicense DETECTED_B = license("LicenseRef-b", DETECTED);

    @Nested
    class AllTest {

        private final LicenseView view = LicenseView.ALL;

        @Test
        void shouldReturnLicensesOfAllSources() {
            assertThat(view.licenses(PACKAGE_WITHOUT_LICENSE, List.of())).isEmpty();
            assertThat(view.licenses(PACKAGE_WITHOUT_LICENSE, DETECTED_LICENSES))
                    .containsExactly(DETECTED_A, DETECTED_B);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_CONCLUDED_LICENSE, List.of()))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_CONCLUDED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B, DETECTED_A, DETECTED_B);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_DECLARED_LICENSE, List.of()))
                    .containsExactly(DECLARED_APACHE, DECLARED_MIT);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(DECLARED_APACHE, DECLARED_MIT, DETECTED_A, DETECTED_B);
            assertThat(view.licenses(PACKAGE_WITH_CONCLUDED_AND_DECLARED_LICENSE, List.of()))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B, DECLARED_APACHE, DECLARED_MIT);
            assertThat(view.licenses(PACKAGE_WITH_CONCLUDED_AND_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B, DECLARED_APACHE, DECLARED_MIT, DETECTED_A, DETECTED_B);
        }

    }

    @Nested
    class ConcludedOrRestTest {

        private final LicenseView view = LicenseView.CONCLUDED_OR_REST;

        @Test
        void shouldPreferConcludedLicense() {
            assertThat(view.licenses(PACKAGE_WITHOUT_LICENSE, List.of())).isEmpty();
            assertThat(view.licenses(PACKAGE_WITHOUT_LICENSE, DETECTED_LICENSES))
                    .containsExactly(DETECTED_A, DETECTED_B);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_CONCLUDED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_DECLARED_LICENSE, List.of()))
                    .containsExactly(DECLARED_APACHE, DECLARED_MIT);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(DECLARED_APACHE, DECLARED_MIT, DETECTED_A, DETECTED_B);
            assertThat(view.licenses(PACKAGE_WITH_CONCLUDED_AND_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B);
        }

    }

    @Nested
    class ConcludedOrDeclaredOrDetectedTest {

        private final LicenseView view = LicenseView.CONCLUDED_OR_DECLARED_OR_DETECTED;

        @Test
        void shouldFallThroughSourcesInOrder() {
            assertThat(view.licenses(PACKAGE_WITHOUT_LICENSE, List.of())).isEmpty();
            assertThat(view.licenses(PACKAGE_WITHOUT_LICENSE, DETECTED_LICENSES))
                    .containsExactly(DETECTED_A, DETECTED_B);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_CONCLUDED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(DECLARED_APACHE, DECLARED_MIT);
            assertThat(view.licenses(PACKAGE_WITH_CONCLUDED_AND_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B);
        }

        @Test
        void shouldIgnoreBlankDeclaredLicenses() {
            final var pkg = new Package(PACKAGE_ID, Set.of(" "), null);

            assertThat(view.licenses(pkg, DETECTED_LICENSES)).containsExactly(DETECTED_A, DETECTED_B);
        }

    }

    @Nested
    class ConcludedOrDetectedTest {

        private final LicenseView view = LicenseView.CONCLUDED_OR_DETECTED;

        @Test
        void shouldNeverConsiderDeclaredLicenses() {
            assertThat(view.licenses(PACKAGE_WITHOUT_LICENSE, DETECTED_LICENSES))
                    .containsExactly(DETECTED_A, DETECTED_B);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_CONCLUDED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B);
            assertThat(view.licenses(PACKAGE_WITH_ONLY_DECLARED_LICENSE, List.of())).isEmpty();
            assertThat(view.licenses(PACKAGE_WITH_ONLY_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(DETECTED_A, DETECTED_B);
            assertThat(view.licenses(PACKAGE_WITH_CONCLUDED_AND_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B);
        }

    }

    @Nested
    class OnlySourceTest {

        @Test
        void shouldOnlyReturnConcludedLicenses() {
            final LicenseView view = LicenseView.ONLY_CONCLUDED;

            assertThat(view.licenses(PACKAGE_WITHOUT_LICENSE, DETECTED_LICENSES)).isEmpty();
            assertThat(view.licenses(PACKAGE_WITH_ONLY_DECLARED_LICENSE, DETECTED_LICENSES)).isEmpty();
            assertThat(view.licenses(PACKAGE_WITH_CONCLUDED_AND_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(CONCLUDED_A, CONCLUDED_B);
        }

        @Test
        void shouldOnlyReturnDeclaredLicenses() {
            final LicenseView view = LicenseView.ONLY_DECLARED;

            assertThat(view.licenses(PACKAGE_WITHOUT_LICENSE, DETECTED_LICENSES)).isEmpty();
            assertThat(view.licenses(PACKAGE_WITH_ONLY_CONCLUDED_LICENSE, DETECTED_LICENSES)).isEmpty();
            assertThat(view.licenses(PACKAGE_WITH_CONCLUDED_AND_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(DECLARED_APACHE, DECLARED_MIT);
        }

        @Test
        void shouldOnlyReturnDetectedLicenses() {
            final LicenseView view = LicenseView.ONLY_DETECTED;

            assertThat(view.licenses(PACKAGE_WITHOUT_LICENSE, List.of())).isEmpty();
            assertThat(view.licenses(PACKAGE_WITH_CONCLUDED_AND_DECLARED_LICENSE, DETECTED_LICENSES))
                    .containsExactly(DETECTED_A, DETECTED_B);
        }

    }

    @Nested
    class ConcludedLicenseTest {

        @ParameterizedTest
        @EnumSource(LicenseView.class)
        void shouldTreatMalformedConcludedLicenseAsAbsent(final LicenseView view) {
            final var malformedPkg = new Package(PACKAGE_ID, new LinkedHashSet<>(List.of("Apache-2.0", "MIT")), "LicenseRef-a AND (");
            final var pkgWithoutConcluded = new Package(PACKAGE_ID, new LinkedHashSet<>(List.of("Apache-2.0", "MIT")), null);

            assertThat(view.licenses(malformedPkg, DETECTED_LICENSES))
                    .isEqualTo(view.licenses(pkgWithoutConcluded, DETECTED_LICENSES));
        }

        @Test
        void shouldDecomposeWithExpressionsIntoLicense() {
            final var pkg = new Package(PACKAGE_ID, Set.of(), "GPL-2.0-only WITH Classpath-exception-2.0 OR MIT");

            assertThat(LicenseView.ONLY_CONCLUDED.licenses(pkg, List.of())).containsExactly(
                    license("GPL-2.0-only", CONCLUDED),
                    license("MIT", CONCLUDED));
        }

        @Test
        void shouldRenderOrLaterLicensesAsSingleLicense() {
            final var pkg = new Package(PACKAGE_ID, Set.of(), "GPL-2.0+ AND MIT");

            assertThat(LicenseView.ONLY_CONCLUDED.licenses(pkg, List.of())).containsExactly(
                    license("GPL-2.0+", CONCLUDED),
                    license("MIT", CONCLUDED));
        }

        @Test
        void shouldDeduplicateLicensesPerSource() {
            final var pkg = new Package(PACKAGE_ID, Set.of("MIT"), "MIT OR (MIT AND Apache-2.0)");

            assertThat(LicenseView.ALL.licenses(pkg, List.of(new LicenseFinding("MIT", new TextLocation("LICENSE")))))
                    .containsExactly(
                            license("MIT", CONCLUDED),
                            license("Apache-2.0", CONCLUDED),
                            license("MIT", DECLARED),
                            license("MIT", DETECTED));
        }

    }

    @Nested
    class OfTest {

        @ParameterizedTest
        @CsvSource({
                "ALL, ALL",
                "concluded-or-rest, CONCLUDED_OR_REST",
                "Concluded_Or_Declared_Or_Detected, CONCLUDED_OR_DECLARED_OR_DETECTED",
                "only-detected, ONLY_DETECTED"
        })
        void shouldResolveViewByName(final String name, final LicenseView expectedView) {
            assertThat(LicenseView.of(name)).isEqualTo(expectedView);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "concluded", "ONLY_CURATED"})
        void shouldThrowForUnknownName(final String name) {
            assertThatExceptionOfType(IllegalArgumentException.class)
                    .isThrownBy(() -> LicenseView.of(name))
                    .withMessage("Unknown license view: " + name);
        }

    }

}
