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

/**
 * Origin of a license statement about a {@link Package}.
 * <p>
 * There is no global order of trust between sources. How sources take precedence over
 * each other is decided by the consumer.
 *
 * @since 1.0.0
 */
public enum LicenseSource {

    /**
     * The license was declared in the package's manifest metadata.
     */
    DECLARED,

    /**
     * The license was concluded by a human, e.g. by means of a {@link PackageCuration}.
     */
    CONCLUDED,

    /**
     * The license was detected by scanning the package's source files.
     */
    DETECTED

}
