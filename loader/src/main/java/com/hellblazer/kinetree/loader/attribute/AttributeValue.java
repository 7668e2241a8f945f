/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Kinetree.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.kinetree.loader.attribute;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Value of an element attribute. Every value starts out as {@link Text}; numeric coercion replaces the values that
 * parse as whitespace separated floating point literals with {@link Numeric}. Both variants retain the literal as
 * written.
 *
 * @author hal.hildebrand
 */
public sealed interface AttributeValue permits AttributeValue.Numeric, AttributeValue.Text {

    static Text text(String raw) {
        return new Text(raw);
    }

    /**
     * @return the numbers, if the value is numeric
     */
    Optional<double[]> numbers();

    /**
     * @return the literal as it appeared in the document
     */
    String raw();

    /**
     * A vector of one or more numbers. A scalar is a vector of length one.
     */
    record Numeric(String raw, double[] values) implements AttributeValue {
        public Numeric {
            Objects.requireNonNull(raw, "raw");
            if (values.length == 0) {
                throw new IllegalArgumentException("Numeric value requires at least one number");
            }
            values = values.clone();
        }

        @Override
        public Optional<double[]> numbers() {
            return Optional.of(values.clone());
        }

        @Override
        public double[] values() {
            return values.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Numeric other)) {
                return false;
            }
            return raw.equals(other.raw) && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return 31 * raw.hashCode() + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return Arrays.toString(values);
        }
    }

    record Text(String raw) implements AttributeValue {
        public Text {
            Objects.requireNonNull(raw, "raw");
        }

        @Override
        public Optional<double[]> numbers() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return raw;
        }
    }
}
