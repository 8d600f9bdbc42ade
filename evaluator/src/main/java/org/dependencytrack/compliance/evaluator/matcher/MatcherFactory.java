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
package org.dependencytrack.compliance.evaluator.matcher;

import org.dependencytrack.compliance.evaluator.DependencyRule;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Creates a {@link Matcher} for a given {@link DependencyRule} context.
 * <p>
 * Rules are defined in terms of {@link MatcherFactory}s, which are bound to
 * a concrete context for every node of the dependency tree they are evaluated on.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MatcherFactory {

    Matcher create(DependencyRule rule);

    static MatcherFactory allOf(final List<MatcherFactory> factories) {
        final List<MatcherFactory> operands = List.copyOf(factories);
        return rule -> Matchers.allOf(createAll(operands, rule));
    }

    static MatcherFactory anyOf(final List<MatcherFactory> factories) {
        final List<MatcherFactory> operands = List.copyOf(factories);
        return rule -> Matchers.anyOf(createAll(operands, rule));
    }

    static MatcherFactory not(final MatcherFactory factory) {
        requireNonNull(factory, "factory must not be null");
        return rule -> Matchers.not(factory.create(rule));
    }

    private static List<Matcher> createAll(final List<MatcherFactory> factories, final DependencyRule rule) {
        final var matchers = new ArrayList<Matcher>(factories.size());
        for (final MatcherFactory factory : factories) {
            matchers.add(factory.create(rule));
        }

        return matchers;
    }

}
