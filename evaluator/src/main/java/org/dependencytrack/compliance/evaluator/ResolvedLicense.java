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

import org.dependencytrack.compliance.model.LicenseSource;

import static java.util.Objects.requireNonNull;

/**
 * A license of a package, together with the source it was obtained from.
 *
 * @param license The license identifier
 * @param source  The {@link LicenseSource} of the license
 * @since 1.0.0
 */
public record ResolvedLicense(String license, LicenseSource source) {

    public ResolvedLicense {
        requireNonNull(license, "license must not be null");
        requireNonNull(source, "source must not be null");
        if (license.isBlank()) {
            throw new IllegalArgumentException("license must not be blank");
        }
    }

}
