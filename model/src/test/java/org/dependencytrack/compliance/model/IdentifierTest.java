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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class IdentifierTest {

    @Test
    void shouldParsePackageUrl() {
        final Identifier id = Identifier.of("pkg:maven/org.acme/acme-lib@1.2.3");

        assertThat(id.type()).isEqualTo("maven");
        assertThat(id.namespace()).isEqualTo("org.acme");
        assertThat(id.name()).isEqualTo("acme-lib");
        assertThat(id.version()).isEqualTo("1.2.3");
        assertThat(id).hasToString("pkg:maven/org.acme/acme-lib@1.2.3");
    }

    @Test
    void shouldAllowMissingNamespaceAndVersion() {
        final Identifier id = new Identifier("npm", null, "left-pad", null);

        assertThat(id.toPurl()).isEqualTo("pkg:npm/left-pad");
        assertThat(Identifier.of(id.toPurl())).isEqualTo(id);
    }

    @Test
    void shouldNormalizeTypeLikeParsedPackageUrl() {
        final Identifier id = new Identifier("Maven", "org.acme", "acme-lib", "1.0");

        assertThat(id.type()).isEqualTo("maven");
        assertThat(id).isEqualTo(Identifier.of("pkg:maven/org.acme/acme-lib@1.0"));
        assertThat(id).hasSameHashCodeAs(Identifier.of("pkg:maven/org.acme/acme-lib@1.0"));
    }

    @Test
    void shouldNormalizePypiNames() {
        final Identifier id = new Identifier("pypi", null, "Django_Rest", "3.0");

        assertThat(id.name()).isEqualTo("django-rest");
        assertThat(id).isEqualTo(Identifier.of("pkg:pypi/django-rest@3.0"));
    }

    @Test
    void shouldThrowForMalformedPackageUrl() {
        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(() -> Identifier.of("maven:org.acme:acme-lib:1.2.3"))
                .withMessage("Invalid Package URL: maven:org.acme:acme-lib:1.2.3");
    }

    @Test
    void shouldThrowWhenNameIsNull() {
        assertThatExceptionOfType(NullPointerException.class)
                .isThrownBy(() -> new Identifier("npm", null, null, null))
                .withMessage("name must not be null");
    }

    @Test
    void shouldOrderByPackageUrl() {
        final Identifier a = Identifier.of("pkg:npm/a@1.0.0");
        final Identifier b = Identifier.of("pkg:npm/b@1.0.0");

        assertThat(a).isLessThan(b);
    }

}
