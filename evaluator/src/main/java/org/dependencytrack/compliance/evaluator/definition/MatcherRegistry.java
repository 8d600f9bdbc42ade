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
import org.dependencytrack.compliance.evaluator.matcher.MatcherFactory;
import org.dependencytrack.compliance.model.LicenseSource;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * Registry of the atoms that rule definitions can reference by name.
 * <p>
 * Atoms are registered explicitly. {@link #withBuiltins()} provides a registry
 * with an atom for every condition exposed by {@link DependencyRule}, except for
 * ancestor conditions, which have a dedicated syntax.
 *
 * @since 1.0.0
 */
public final class MatcherRegistry {

    /**
     * Creates a {@link MatcherFactory} from the arguments given to an atom.
     */
    @FunctionalInterface
    public interface AtomFactory {

        /**
         * @param args The arguments of the atom. The number of arguments has been validated already
         * @return The {@link MatcherFactory}
         * @throws InvalidRuleDefinitionException When an argument is invalid
         */
        MatcherFactory create(List<String> args);

    }

    private record Atom(int arity, boolean variadic, AtomFactory factory) {
    }

    private final Map<String, Atom> atomByName = new HashMap<>();

    /**
     * @return A {@link MatcherRegistry} with all built-in atoms registered
     */
    public static MatcherRegistry withBuiltins() {
        return new MatcherRegistry()
                .register("is_at_tree_level", 1, args -> {
                    final int level = parseLevel(args.get(0));
                    return rule -> rule.isAtTreeLevel(level);
                })
                .register("is_project_from_org", 1, args -> rule -> rule.isProjectFromOrg(args.get(0)))
                .register("is_statically_linked", 0, args -> DependencyRule::isStaticallyLinked)
                .register("is_in_scope", 1, args -> rule -> rule.isInScope(args.get(0)))
                .register("is_scope_excluded", 0, args -> DependencyRule::isScopeExcluded)
                .register("is_from_package_manager", 1, args -> rule -> rule.isFromPackageManager(args.get(0)))
                .register("has_license", 1, args -> rule -> rule.hasLicense(args.get(0)))
                .register("has_no_license", 0, args -> DependencyRule::hasNoLicense)
                .registerVariadic("has_only_licenses_in", 1, args -> rule -> rule.hasOnlyLicensesIn(args))
                .register("has_license_from_source", 1, args -> {
                    final LicenseSource source = parseLicenseSource(args.get(0));
                    return rule -> rule.hasLicenseFromSource(source);
                })
                .register("is_license", 1, args -> rule -> rule.isLicense(args.get(0)))
                .register("is_license_from_source", 1, args -> {
                    final LicenseSource source = parseLicenseSource(args.get(0));
                    return rule -> rule.isLicenseFromSource(source);
                });
    }

    /**
     * Register an atom that takes exactly {@code arity} arguments.
     *
     * @throws IllegalStateException When an atom with the same name is already registered
     */
    public MatcherRegistry register(final String name, final int arity, final AtomFactory factory) {
        return register(name, new Atom(arity, false, requireNonNull(factory, "factory must not be null")));
    }

    /**
     * Register an atom that takes at least {@code minArity} arguments.
     *
     * @throws IllegalStateException When an atom with the same name is already registered
     */
    public MatcherRegistry registerVariadic(final String name, final int minArity, final AtomFactory factory) {
        return register(name, new Atom(minArity, true, requireNonNull(factory, "factory must not be null")));
    }

    /**
     * @param name Name of the atom
     * @param args Arguments of the atom
     * @return The {@link MatcherFactory} for the atom
     * @throws InvalidRuleDefinitionException When no atom with {@code name} exists,
     *                                        or {@code args} are not valid for it
     */
    public MatcherFactory create(final String name, final List<String> args) {
        requireNonNull(name, "name must not be null");
        requireNonNull(args, "args must not be null");

        final Atom atom = atomByName.get(name);
        if (atom == null) {
            throw new InvalidRuleDefinitionException("Unknown atom '%s'; Available atoms are: %s"
                    .formatted(name, String.join(", ", getAtomNames())));
        }

        if (atom.variadic() && args.size() < atom.arity()) {
            throw new InvalidRuleDefinitionException("Atom '%s' requires at least %d arguments, but got %d"
                    .formatted(name, atom.arity(), args.size()));
        } else if (!atom.variadic() && args.size() != atom.arity()) {
            throw new InvalidRuleDefinitionException("Atom '%s' requires %d arguments, but got %d"
                    .formatted(name, atom.arity(), args.size()));
        }

        return atom.factory().create(List.copyOf(args));
    }

    /**
     * @return Names of all registered atoms, in alphabetical order
     */
    public Set<String> getAtomNames() {
        return Collections.unmodifiableSet(new TreeSet<>(atomByName.keySet()));
    }

    private MatcherRegistry register(final String name, final Atom atom) {
        requireNonNull(name, "name must not be null");
        if (atom.arity() < 0) {
            throw new IllegalArgumentException("arity must not be negative, but is " + atom.arity());
        }
        if (atomByName.putIfAbsent(name, atom) != null) {
            throw new IllegalStateException("An atom named '%s' is already registered".formatted(name));
        }

        return this;
    }

    private static int parseLevel(final String value) {
        try {
            final int level = Integer.parseInt(value.trim());
            if (level < 0) {
                throw new InvalidRuleDefinitionException("Tree level must not be negative, but is " + level);
            }

            return level;
        } catch (NumberFormatException e) {
            throw new InvalidRuleDefinitionException("Tree level must be an integer, but is '%s'".formatted(value), e);
        }
    }

    private static LicenseSource parseLicenseSource(final String value) {
        try {
            return LicenseSource.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleDefinitionException("Unknown license source '%s'".formatted(value), e);
        }
    }

}
