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
package org.dependencytrack.compliance.evaluator.definition;

import org.dependencytrack.compliance.evaluator.DependencyRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class MatcherRegistryTest {

    @Test
    void shouldRegisterBuiltins() {
        assertThat(MatcherRegistry.withBuiltins().getAtomNames()).containsExactly(
                "has_license",
                "has_license_from_source",
                "has_no_license",
                "has_only_licenses_in",
                "is_at_tree_level",
                "is_from_package_manager",
                "is_in_scope",
                "is_license",
                "is_license_from_source",
                "is_project_from_org",
                "is_scope_excluded",
                "is_statically_linked");
    }

    @Test
    void shouldRejectDuplicateRegistrations() {
        final var registry = new MatcherRegistry().register("is_statically_linked", 0, args -> DependencyRule::isStaticallyLinked);

        assertThatExceptionOfType(IllegalStateException.class)
                .isThrownBy(() -> registry.register("is_statically_linked", 0, args -> DependencyRule::isStaticallyLinked))
                .withMessage("An atom named 'is_statically_linked' is already registered");
    }

    @Test
    void shouldValidateArity() {
        final MatcherRegistry registry = MatcherRegistry.withBuiltins();

        assertThat(registry.create("has_only_licenses_in", List.of("MIT", "Apache-2.0", "BSD-3-Clause"))).isNotNull();
        assertThatExceptionOfType(InvalidRuleDefinitionException.class)
                .isThrownBy(() -> registry.create("has_only_licenses_in", List.of()))
                .withMessage("Atom 'has_only_licenses_in' requires at least 1 arguments, but got 0");
        assertThatExceptionOfType(InvalidRuleDefinitionException.class)
                .isThrownBy(() -> registry.create("is_statically_linked", List.of("yes")))
                .withMessage("Atom 'is_statically_linked' requires 0 arguments, but got 1");
    }

    @Test
    void shouldRejectUnknownLicenseSource() {
        assertThatExceptionOfType(InvalidRuleDefinitionException.class)
                .isThrownBy(() -> MatcherRegistry.withBuiltins().create("has_license_from_source", List.of("CURATED")))
                .withMessage("Unknown license source 'CURATED'");
    }

}
