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

import org.apache.commons.lang3.StringUtils;
import org.dependencytrack.compliance.evaluator.matcher.MatchResult;
import org.dependencytrack.compliance.evaluator.matcher.Matcher;
import org.dependencytrack.compliance.evaluator.walker.DependencyVisit;
import org.dependencytrack.compliance.model.Identifier;
import org.dependencytrack.compliance.model.Project;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates {@link Rule}s against every node of every dependency tree of a {@link RuleSet}.
 * <p>
 * Rules are evaluated in the order they are given. Each rule is evaluated once for every
 * {@link LicenseView} it references, and, when evaluated per license, once for every license
 * of a package under that view. Violations are not deduplicated.
 * <p>
 * Conditions that can not be evaluated in a given context do not abort the evaluation.
 * They are recorded as {@link EvaluationFailure}s instead.
 *
 * @since 1.0.0
 */
public final class Evaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Evaluator.class);

    private static final String[] PLACEHOLDERS = {
            "${rule}", "${package}", "${license}", "${licenseSource}", "${scope}", "${project}", "${level}"
    };

    private final RuleSet ruleSet;

    /**
     * @param ruleSet The {@link RuleSet} to evaluate against. Its {@link EvaluatorConfig}
     *                determines the default {@link LicenseView} of rules that reference none.
     */
    public Evaluator(final RuleSet ruleSet) {
        this.ruleSet = requireNonNull(ruleSet, "ruleSet must not be null");
    }

    /**
     * Evaluate {@code rules} against {@code ruleSet}.
     *
     * @param ruleSet The {@link RuleSet} to evaluate against
     * @param rules   The {@link Rule}s to evaluate
     * @return The {@link Violation}s, in evaluation order
     */
    public static List<Violation> evaluateRules(final RuleSet ruleSet, final List<Rule> rules) {
        return new Evaluator(ruleSet).evaluate(rules).violations();
    }

    public EvaluatorRun evaluate(final List<Rule> rules) {
        requireNonNull(rules, "rules must not be null");

        final Instant startTime = Instant.now();
        final var violations = new ArrayList<Violation>();
        final var failures = new ArrayList<EvaluationFailure>();

        final LicenseView defaultView = ruleSet.getConfig().defaultLicenseView();
        for (final Rule rule : rules) {
            final List<LicenseView> views = rule.licenseViews().isEmpty()
                    ? List.of(defaultView)
                    : rule.licenseViews();

            for (final LicenseView view : views) {
                LOGGER.debug("Evaluating rule {} with license view {}", rule.name(), view);

                for (final DependencyVisit visit : ruleSet.getWalker()) {
                    final var context = new DependencyRule(ruleSet, rule.name(), visit, view);
                    if (!rule.perLicense()) {
                        evaluate(rule, context, violations, failures);
                        continue;
                    }

                    for (final ResolvedLicense license : context.getResolvedLicenses()) {
                        evaluate(rule, context.withLicense(license), violations, failures);
                    }
                }
            }
        }

        final var run = new EvaluatorRun(startTime, Instant.now(), violations, failures);
        LOGGER.info("Evaluated {} rules in {}ms; Raised {} violations, {} evaluations failed",
                rules.size(), run.duration().toMillis(), violations.size(), failures.size());

        return run;
    }

    private void evaluate(
            final Rule rule,
            final DependencyRule context,
            final List<Violation> violations,
            final List<EvaluationFailure> failures) {
        final Matcher matcher = rule.condition().create(context);
        final MatchResult result = matcher.evaluate();

        if (result instanceof final MatchResult.Failed failed) {
            LOGGER.warn("Failed to evaluate rule {} for {} in scope {}: {} ({})",
                    rule.name(), context.getPackage().id(), context.getScope().name(),
                    failed.reason(), failed.description());
            failures.add(new EvaluationFailure(
                    rule.name(),
                    context.getPackage().id(),
                    projectId(context),
                    context.getScope().name(),
                    context.getLevel(),
                    failed.reason()));
            return;
        }

        final boolean isViolation = switch (rule.polarity()) {
            case FLAG_IF_MATCHED -> result.isMatched();
            case REQUIRE -> !result.isMatched();
        };
        if (!isViolation) {
            return;
        }

        LOGGER.debug("Rule {} is violated by {}: {}", rule.name(), context.getPackage().id(), matcher.description());
        final ResolvedLicense license = context.getLicense();
        violations.add(new Violation(
                rule.name(),
                context.getPackage().id(),
                license != null ? license.license() : null,
                license != null ? license.source() : null,
                rule.severity(),
                render(rule.message(), rule, context),
                rule.howToFix() != null ? render(rule.howToFix(), rule, context) : null,
                projectId(context),
                context.getScope().name(),
                context.getLevel(),
                context.getLicenseView()));
    }

    static String render(final String template, final Rule rule, final DependencyRule context) {
        final ResolvedLicense license = context.getLicense();
        final Identifier projectId = projectId(context);

        final String[] replacements = {
                rule.name(),
                context.getPackage().id().toString(),
                license != null ? license.license() : "",
                license != null ? license.source().name() : "",
                context.getScope().name(),
                projectId != null ? projectId.toString() : "",
                String.valueOf(context.getLevel())
        };

        return StringUtils.replaceEach(template, PLACEHOLDERS, replacements);
    }

    private static @Nullable Identifier projectId(final DependencyRule context) {
        final Project project = context.getProject();
        return project != null ? project.id() : null;
    }

}
