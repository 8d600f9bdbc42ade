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
package org.dependencytrack.compliance.spdx.expression;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Two expressions joined by an {@link SpdxOperator}.
 *
 * @since 1.0.0
 */
public record SpdxCompoundExpression(
        SpdxExpression left,
        SpdxOperator operator,
        SpdxExpression right) implements SpdxExpression {

    public SpdxCompoundExpression {
        requireNonNull(left, "left must not be null");
        requireNonNull(operator, "operator must not be null");
        requireNonNull(right, "right must not be null");
    }

    @Override
    public Set<SpdxLicenseIdExpression> decompose() {
        final var licenses = new LinkedHashSet<SpdxLicenseIdExpression>();
        licenses.addAll(left.decompose());
        licenses.addAll(right.decompose());
        return Collections.unmodifiableSet(licenses);
    }

    @Override
    public String toString() {
        return toOperandString(left) + " " + operator + " " + toOperandString(right);
    }

    private String toOperandString(final SpdxExpression operand) {
        // AND binds stronger than OR, so only OR operands of AND need parentheses.
        if (operand instanceof final SpdxCompoundExpression compound
                && compound.operator() == SpdxOperator.OR
                && operator == SpdxOperator.AND) {
            return "(" + compound + ")";
        }

        return operand.toString();
    }

}
