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

import static java.util.Objects.requireNonNull;

/**
 * A license detected by scanning the files of a {@link Package}.
 *
 * @param license    The detected license, as SPDX expression
 * @param location   Where the license was detected
 * @param provenance Where the scanned code came from
 * @since 1.0.0
 */
public record LicenseFinding(String license, TextLocation location, Provenance provenance) {

    public LicenseFinding {
        requireNonNull(license, "license must not be null");
        requireNonNull(location, "location must not be null");
        requireNonNull(provenance, "provenance must not be null");
    }

    public LicenseFinding(final String license, final TextLocation location) {
        this(license, location, Provenance.UNKNOWN);
    }

}
