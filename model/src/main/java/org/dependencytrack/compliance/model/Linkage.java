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
 * How a dependency is linked into the artifact that depends on it.
 *
 * @since 1.0.0
 */
public enum Linkage {

    DYNAMIC,

    STATIC,

    /**
     * A project dependency that is linked dynamically.
     */
    PROJECT_DYNAMIC,

    /**
     * A project dependency that is linked statically.
     */
    PROJECT_STATIC;

    public boolean isStatic() {
        return this == STATIC || this == PROJECT_STATIC;
    }

}
