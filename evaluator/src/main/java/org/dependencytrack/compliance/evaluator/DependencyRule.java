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

import org.dependencytrack.compliance.evaluator.matcher.Matcher;
import org.dependencytrack.compliance.evaluator.matcher.Matchers;
import org.dependencytrack.compliance.evaluator.walker.DependencyVisit;
import org.dependencytrack.compliance.model.Identifier;
import org.dependencytrack.compliance.model.LicenseFinding;
import org.dependencytrack.compliance.model.LicenseSource;
import org.dependencytrack.compliance.model.Package;
import org.dependencytrack.compliance.model.PackageCuration;
import org.dependencytrack.compliance.model.PackageReference;
import org.dependencytrack.compliance.model.Project;
import org.dependencytrack.compliance.model.Scope;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * The context a rule is evaluated in: a single node of a dependency tree,
 * as seen through a {@link LicenseView}.
 * <p>
 * For rules that are evaluated per license, the context additionally carries
 * the license currently being evaluated.
 * <p>
 * The atoms exposed by this class create {@link Matcher}s bound to this context.
 * All data the atoms operate on is resolved at construction.
 *
 * @since 1.0.0
 */
public final class DependencyRule {

    private final RuleSet ruleSet;
    private final String ruleName;
    private final DependencyVisit visit;
    private final LicenseView licenseView;
    private final List<PackageCuration> curations;
    private final List<LicenseFinding> detectedLicenses;
    private final Set<ResolvedLicense> resolvedLicenses;
    private final @Nullable ResolvedLicense license;

    public DependencyRule(
            final RuleSet ruleSet,
            final String ruleName,
            final DependencyVisit visit,
            final LicenseView licenseView) {
        this(ruleSet, ruleName, visit, licenseView, null);
    }

    public DependencyRule(
            final RuleSet ruleSet,
            final String ruleName,
            final DependencyVisit visit,
            final LicenseView licenseView,
            final @Nullable ResolvedLicense license) {
        this.ruleSet = requireNonNull(ruleSet, "ruleSet must not be null");
        this.ruleName = requireNonNull(ruleName, "ruleName must not be null");
        this.visit = requireNonNull(visit, "visit must not be null");
        this.licenseView = requireNonNull(licenseView, "licenseView must not be null");
        this.curations = ruleSet.getCurations(visit.pkg().id());
        this.detectedLicenses = ruleSet.getDetectedLicenses(visit.pkg().id());
        this.resolvedLicenses = ruleSet.getLicenseResolver().resolveLicenses(licenseView, visit.pkg(), detectedLicenses);
        this.license = license;
    }

    private DependencyRule(final DependencyRule other, final ResolvedLicense license) {
        this.ruleSet = other.ruleSet;
        this.ruleName = other.ruleName;
        this.visit = other.visit;
        this.licenseView = other.licenseView;
        this.curations = other.curations;
        this.detectedLicenses = other.detectedLicenses;
        this.resolvedLicenses = other.resolvedLicenses;
        this.license = license;
    }

    /**
     * @param license The license to evaluate
     * @return A copy of this context, bound to {@code license}
     */
    public DependencyRule withLicense(final ResolvedLicense license) {
        return new DependencyRule(this, requireNonNull(license, "license must not be null"));
    }

    public RuleSet getRuleSet() {
        return ruleSet;
    }

    public String getRuleName() {
        return ruleName;
    }

    public Package getPackage() {
        return visit.pkg();
    }

    public PackageReference getDependency() {
        return visit.dependency();
    }

    public List<Package> getAncestors() {
        return visit.ancestors();
    }

    public int getLevel() {
        return visit.level();
    }

    public Scope getScope() {
        return visit.scope();
    }

    public @Nullable Project getProject() {
        return visit.project();
    }

    public LicenseView getLicenseView() {
        return licenseView;
    }

    public List<PackageCuration> getCurations() {
        return curations;
    }

    public List<LicenseFinding> getDetectedLicenses() {
        return detectedLicenses;
    }

    /**
     * @return The licenses of the package, as seen through {@link #getLicenseView()}
     */
    public Set<ResolvedLicense> getResolvedLicenses() {
        return resolvedLicenses;
    }

    /**
     * @return The license being evaluated, or {@code null} when the rule is not evaluated per license
     */
    public @Nullable ResolvedLicense getLicense() {
        return license;
    }

    public Matcher isAtTreeLevel(final int level) {
        return Matchers.condition("is at tree level " + level, () -> visit.level() == level);
    }

    /**
     * @param org The organization, i.e. the namespace of the project's {@link Identifier}
     * @return A {@link Matcher} that matches when the enclosing project belongs to {@code org}.
     * Fails when the dependency is not part of a project.
     */
    public Matcher isProjectFromOrg(final String org) {
        requireNonNull(org, "org must not be null");

        final String description = "is project from org '" + org + "'";
        final Project project = visit.project();
        if (project == null) {
            return Matchers.failed(description, "Dependency %s is not part of a project".formatted(visit.pkg().id()));
        }

        return Matchers.condition(description, () -> org.equals(project.id().namespace()));
    }

    public Matcher isStaticallyLinked() {
        return Matchers.condition("is statically linked", () -> visit.dependency().getLinkage().isStatic());
    }

    /**
     * @param licenseId The license to look for, compared case-insensitively
     * @return A {@link Matcher} that matches when the package has {@code licenseId}
     */
    public Matcher hasLicense(final String licenseId) {
        requireNonNull(licenseId, "licenseId must not be null");
        return Matchers.condition("has license '" + licenseId + "'",
                () -> resolvedLicenses.stream().anyMatch(resolved -> resolved.license().equalsIgnoreCase(licenseId)));
    }

    public Matcher hasNoLicense() {
        return Matchers.condition("has no license", resolvedLicenses::isEmpty);
    }

    /**
     * @param licenseIds The allowed licenses, compared case-insensitively
     * @return A {@link Matcher} that matches when none of the package's licenses is outside of {@code licenseIds}
     */
    public Matcher hasOnlyLicensesIn(final Collection<String> licenseIds) {
        requireNonNull(licenseIds, "licenseIds must not be null");

        final Set<String> allowed = licenseIds.stream()
                .map(licenseId -> licenseId.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return Matchers.condition("has only licenses in " + licenseIds,
                () -> resolvedLicenses.stream()
                        .map(resolved -> resolved.license().toLowerCase(Locale.ROOT))
                        .allMatch(allowed::contains));
    }

    public Matcher hasLicenseFromSource(final LicenseSource source) {
        requireNonNull(source, "source must not be null");
        return Matchers.condition("has license from source " + source,
                () -> resolvedLicenses.stream().anyMatch(resolved -> resolved.source() == source));
    }

    public Matcher isLicense(final String licenseId) {
        requireNonNull(licenseId, "licenseId must not be null");

        final String description = "is license '" + licenseId + "'";
        if (license == null) {
            return Matchers.failed(description, "Rule %s is not evaluated per license".formatted(ruleName));
        }

        final ResolvedLicense current = license;
        return Matchers.condition(description, () -> current.license().equalsIgnoreCase(licenseId));
    }

    public Matcher isLicenseFromSource(final LicenseSource source) {
        requireNonNull(source, "source must not be null");

        final String description = "is license from source " + source;
        if (license == null) {
            return Matchers.failed(description, "Rule %s is not evaluated per license".formatted(ruleName));
        }

        final ResolvedLicense current = license;
        return Matchers.condition(description, () -> current.source() == source);
    }

    public Matcher isInScope(final String scopeName) {
        requireNonNull(scopeName, "scopeName must not be null");
        return Matchers.condition("is in scope '" + scopeName + "'", () -> visit.scope().name().equals(scopeName));
    }

    public Matcher isScopeExcluded() {
        return Matchers.condition("is in excluded scope", () -> ruleSet.isExcluded(visit.scope()));
    }

    /**
     * @param type The package manager type, e.g. {@code maven} or {@code npm}
     * @return A {@link Matcher} that matches when the package's {@link Identifier#type()} is {@code type}
     */
    public Matcher isFromPackageManager(final String type) {
        requireNonNull(type, "type must not be null");
        return Matchers.condition("is from package manager '" + type + "'",
                () -> visit.pkg().id().type().equalsIgnoreCase(type));
    }

    public Matcher hasAncestor(final Predicate<Package> predicate, final String description) {
        requireNonNull(predicate, "predicate must not be null");
        requireNonNull(description, "description must not be null");
        return Matchers.condition("has ancestor " + description,
                () -> visit.ancestors().stream().anyMatch(predicate));
    }

    public Matcher hasAncestorWithId(final Identifier id) {
        requireNonNull(id, "id must not be null");
        return hasAncestor(ancestor -> ancestor.id().equals(id), "with id " + id);
    }

    @Override
    public String toString() {
        return "DependencyRule{" +
                "ruleName='" + ruleName + '\'' +
                ", package=" + visit.pkg().id() +
                ", scope=" + visit.scope().name() +
                ", level=" + visit.level() +
                ", licenseView=" + licenseView +
                ", license=" + license +
                '}';
    }

}
