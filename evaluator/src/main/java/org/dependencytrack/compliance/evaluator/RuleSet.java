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

import org.dependencytrack.compliance.evaluator.storage.InMemoryScanResultsStorage;
import org.dependencytrack.compliance.evaluator.storage.ScanResultsReadResult;
import org.dependencytrack.compliance.evaluator.storage.ScanResultsStorage;
import org.dependencytrack.compliance.evaluator.walker.DependencyTreeWalker;
import org.dependencytrack.compliance.model.AnalysisResult;
import org.dependencytrack.compliance.model.Identifier;
import org.dependencytrack.compliance.model.LicenseFinding;
import org.dependencytrack.compliance.model.Package;
import org.dependencytrack.compliance.model.PackageCuration;
import org.dependencytrack.compliance.model.Project;
import org.dependencytrack.compliance.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * The data rules are evaluated against: an {@link AnalysisResult}, and the license findings
 * of its packages as provided by a {@link ScanResultsStorage}.
 * <p>
 * A {@link RuleSet} is bound to a single evaluation run and its {@link EvaluatorConfig}.
 * It is read-only, except for memoizing the findings read from the {@link ScanResultsStorage}
 * and the parsed concluded licenses.
 *
 * @since 1.0.0
 */
public final class RuleSet {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleSet.class);

    private final AnalysisResult analysisResult;
    private final ScanResultsStorage scanResultsStorage;
    private final EvaluatorConfig config;
    private final LicenseResolver licenseResolver;
    private final DependencyTreeWalker walker;
    private final ConcurrentMap<Identifier, List<LicenseFinding>> detectedLicensesById = new ConcurrentHashMap<>();

    public RuleSet(
            final AnalysisResult analysisResult,
            final ScanResultsStorage scanResultsStorage,
            final EvaluatorConfig config) {
        this.analysisResult = requireNonNull(analysisResult, "analysisResult must not be null");
        this.scanResultsStorage = requireNonNull(scanResultsStorage, "scanResultsStorage must not be null");
        this.config = requireNonNull(config, "config must not be null");
        this.licenseResolver = new LicenseResolver(config);
        this.walker = new DependencyTreeWalker(analysisResult);
    }

    public RuleSet(final AnalysisResult analysisResult, final ScanResultsStorage scanResultsStorage) {
        this(analysisResult, scanResultsStorage, EvaluatorConfig.DEFAULT);
    }

    public RuleSet(final AnalysisResult analysisResult) {
        this(analysisResult, new InMemoryScanResultsStorage());
    }

    public AnalysisResult getAnalysisResult() {
        return analysisResult;
    }

    public EvaluatorConfig getConfig() {
        return config;
    }

    public LicenseResolver getLicenseResolver() {
        return licenseResolver;
    }

    public DependencyTreeWalker getWalker() {
        return walker;
    }

    public Package getPackage(final Identifier id) {
        return analysisResult.resolvePackage(id);
    }

    public Optional<Project> getProject(final Identifier id) {
        return analysisResult.getProject(id);
    }

    public List<PackageCuration> getCurations(final Identifier id) {
        return analysisResult.getCurations(id);
    }

    public boolean isExcluded(final Scope scope) {
        return analysisResult.isExcluded(scope);
    }

    /**
     * Get the licenses detected for a package.
     * <p>
     * When the findings can not be read from the {@link ScanResultsStorage},
     * the package is treated as if no licenses were detected.
     *
     * @param id The {@link Identifier} of the package
     * @return The detected {@link LicenseFinding}s
     */
    public List<LicenseFinding> getDetectedLicenses(final Identifier id) {
        return detectedLicensesById.computeIfAbsent(id, this::readDetectedLicenses);
    }

    public Set<ResolvedLicense> getLicenses(final LicenseView view, final Package pkg) {
        return licenseResolver.resolveLicenses(view, pkg, getDetectedLicenses(pkg.id()));
    }

    private List<LicenseFinding> readDetectedLicenses(final Identifier id) {
        final ScanResultsReadResult result = scanResultsStorage.read(id);
        if (result instanceof final ScanResultsReadResult.Success success) {
            return success.findings();
        }

        LOGGER.warn("Failed to read scan results for {} from {}; Assuming no detected licenses: {}",
                id, scanResultsStorage.name(), ((ScanResultsReadResult.Failure) result).message());
        return List.of();
    }

}
