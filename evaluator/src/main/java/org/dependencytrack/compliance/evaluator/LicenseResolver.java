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

import org.dependencytrack.compliance.model.LicenseFinding;
import org.dependencytrack.compliance.model.Package;
import org.dependencytrack.compliance.spdx.expression.SpdxExpression;
import org.dependencytrack.compliance.spdx.expression.SpdxExpressionParser;
import org.dependencytrack.compliance.spdx.expression.SpdxParseResult;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * Resolves the licenses of {@link Package}s through a {@link LicenseView}.
 * <p>
 * Concluded licenses that are not valid SPDX expressions are treated as absent.
 * Whether this is logged at {@code WARN} or {@code DEBUG} level is configurable.
 * Concluded licenses are parsed once per {@link Package} and resolver instance,
 * so a malformed one is logged only once.
 *
 * @since 1.0.0
 */
public final class LicenseResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(LicenseResolver.class);

    private final SpdxExpressionParser parser = new SpdxExpressionParser();
    private final ConcurrentMap<Package, Optional<SpdxExpression>> concludedLicenseByPackage = new ConcurrentHashMap<>();
    private final boolean warnOnMalformedConcludedLicense;

    public LicenseResolver(final boolean warnOnMalformedConcludedLicense) {
        this.warnOnMalformedConcludedLicense = warnOnMalformedConcludedLicense;
    }

    public LicenseResolver(final EvaluatorConfig config) {
        this(requireNonNull(config, "config must not be null").logMalformedConcludedLicenses());
    }

    public Set<ResolvedLicense> resolveLicenses(
            final LicenseView view,
            final Package pkg,
            final Collection<LicenseFinding> detectedLicenses) {
        requireNonNull(view, "view must not be null");
        requireNonNull(pkg, "pkg must not be null");
        requireNonNull(detectedLicenses, "detectedLicenses must not be null");

        return view.resolve(parseConcludedLicense(pkg), pkg.declaredLicenses(), detectedLicenses);
    }

    @Nullable SpdxExpression parseConcludedLicense(final Package pkg) {
        if (pkg.concludedLicense() == null) {
            return null;
        }

        return concludedLicenseByPackage.computeIfAbsent(pkg, this::doParseConcludedLicense).orElse(null);
    }

    private Optional<SpdxExpression> doParseConcludedLicense(final Package pkg) {
        final SpdxParseResult result = parser.parse(pkg.concludedLicense());
        if (result instanceof final SpdxParseResult.Success success) {
            return Optional.of(success.expression());
        }

        final String reason = ((SpdxParseResult.Failure) result).reason();
        if (warnOnMalformedConcludedLicense) {
            LOGGER.warn("Concluded license '{}' of {} is malformed and will be ignored: {}",
                    pkg.concludedLicense(), pkg.id(), reason);
        } else {
            LOGGER.debug("Concluded license '{}' of {} is malformed and will be ignored: {}",
                    pkg.concludedLicense(), pkg.id(), reason);
        }

        return Optional.empty();
    }

}
