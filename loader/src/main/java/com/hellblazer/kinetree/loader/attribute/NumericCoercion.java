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

import com.hellblazer.kinetree.loader.document.ElementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts attribute values that are whitespace separated floating point literals into {@link AttributeValue.Numeric}
 * vectors. Values that do not parse stay textual; that is not an error.
 *
 * @author hal.hildebrand
 */
public final class NumericCoercion {

    private static final Logger  log        = LoggerFactory.getLogger(NumericCoercion.class);
    private static final Pattern DECIMAL    = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern SEPARATORS = Pattern.compile("\\s+");

    private NumericCoercion() {
    }

    /**
     * Coerce every textual attribute of every element under, and including, the root, in place
     *
     * @return the number of attributes that became numeric
     */
    public static int coerce(ElementNode root) {
        var coerced = 0;
        for (var node : root.preOrder()) {
            for (var entry : node.attributes().entrySet()) {
                if (!(entry.getValue() instanceof AttributeValue.Text text)) {
                    continue;
                }
                var value = parse(text.raw());
                if (value instanceof AttributeValue.Numeric) {
                    node.put(entry.getKey(), value);
                    coerced++;
                }
            }
        }
        log.debug("Coerced {} attributes to numeric vectors", coerced);
        return coerced;
    }

    /**
     * @param raw the literal as written
     * @return a numeric value if every whitespace separated token is a floating point literal, otherwise text
     */
    public static AttributeValue parse(String raw) {
        var trimmed = raw.strip();
        if (trimmed.isEmpty()) {
            return AttributeValue.text(raw);
        }
        var tokens = SEPARATORS.split(trimmed);
        var values = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            var number = parseLiteral(tokens[i]);
            if (number == null) {
                return AttributeValue.text(raw);
            }
            values[i] = number;
        }
        return new AttributeValue.Numeric(raw, values);
    }

    private static Double parseLiteral(String token) {
        if (DECIMAL.matcher(token).matches()) {
            return Double.parseDouble(token);
        }
        var unsigned = token.startsWith("+") || token.startsWith("-") ? token.substring(1) : token;
        var negative = token.startsWith("-");
        return switch (unsigned.toLowerCase(Locale.ROOT)) {
            case "nan" -> Double.NaN;
            case "inf", "infinity" -> negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            default -> null;
        };
    }
}
