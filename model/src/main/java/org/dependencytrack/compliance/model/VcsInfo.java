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

import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Location of a package's sources in a version control system.
 *
 * @param type     Type of the VCS, e.g. {@code git}
 * @param url      URL of the repository
 * @param revision Revision to check out, e.g. a tag or commit hash
 * @param path     Path within the repository, if the package does not live in its root
 * @since 1.0.0
 */
public record VcsInfo(String type, String url, String revision, @Nullable String path) {

    public static final VcsInfo EMPTY = new VcsInfo("", "", "", null);

    public VcsInfo {
        requireNonNull(type, "type must not be null");
        requireNonNull(url, "url must not be null");
        requireNonNull(revision, "revision must not be null");
    }

}
