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

import io.smallrye.config.ExpressionConfigSourceInterceptor;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of the {@link Evaluator}, bound to a {@link RuleSet} when it is created.
 *
 * @param defaultLicenseView            The {@link LicenseView} to evaluate rules with that do not reference any view
 * @param logMalformedConcludedLicenses Whether malformed concluded licenses are logged at {@code WARN} level,
 *                                      instead of {@code DEBUG}
 * @since 1.0.0
 */
public record EvaluatorConfig(LicenseView defaultLicenseView, boolean logMalformedConcludedLicenses) {

    public static final String PROPERTY_DEFAULT_LICENSE_VIEW = "compliance.evaluator.default-license-view";
    public static final String PROPERTY_LOG_MALFORMED_CONCLUDED_LICENSES = "compliance.evaluator.log-malformed-concluded-licenses";

    public static final EvaluatorConfig DEFAULT = new EvaluatorConfig(LicenseView.CONCLUDED_OR_REST, true);

    public EvaluatorConfig {
        requireNonNull(defaultLicenseView, "defaultLicenseView must not be null");
    }

    /**
     * Read the configuration from a MicroProfile {@link Config}.
     * <p>
     * Properties that are not set fall back to the values of {@link #DEFAULT}.
     *
     * @param config The {@link Config} to read from
     * @return The {@link EvaluatorConfig}
     * @throws IllegalArgumentException When a property has an invalid value
     */
    public static EvaluatorConfig fromConfig(final Config config) {
        requireNonNull(config, "config must not be null");

        final LicenseView defaultLicenseView = config.getOptionalValue(PROPERTY_DEFAULT_LICENSE_VIEW, String.class)
                .map(LicenseView::of)
                .orElse(DEFAULT.defaultLicenseView());
        final boolean logMalformedConcludedLicenses = config.getOptionalValue(PROPERTY_LOG_MALFORMED_CONCLUDED_LICENSES, Boolean.class)
                .orElse(DEFAULT.logMalformedConcludedLicenses());

        return new EvaluatorConfig(defaultLicenseView, logMalformedConcludedLicenses);
    }

    /**
     * Read the configuration from the default config sources:
     *
     * <table>
     *     <tr><th>Source</th><th>Priority</th></tr>
     *     <tr><td>System properties</td><td>400</td></tr>
     *     <tr><td>Environment variables</td><td>300</td></tr>
     *     <tr><td>{@code ${pwd}/.env} file</td><td>295</td></tr>
     *     <tr><td>{@code ${pwd}/config/application.properties}</td><td>260</td></tr>
     *     <tr><td>{@code ${classpath}/application.properties}</td><td>250</td></tr>
     *     <tr><td>{@code ${classpath}/META-INF/microprofile-config.properties}</td><td>100</td></tr>
     * </table>
     *
     * @return The {@link EvaluatorConfig}
     * @see <a href="https://smallrye.io/smallrye-config/Main/config/getting-started/#config-sources">Config sources</a>
     */
    public static EvaluatorConfig fromDefaultSources() {
        final Config config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withInterceptors(new ExpressionConfigSourceInterceptor())
                .build();

        return fromConfig(config);
    }

}
