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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Separates the rendering hints of a geometry from its schema attributes. An attribute is a rendering hint when its
 * name is the reserved prefix, then the separator, then at least one more character. Hints are passed through
 * untouched; only the prefix and separator are stripped from their names.
 *
 * @author hal.hildebrand
 */
public final class VisualMetadataExtractor {

    private final String marker;

    /**
     * @param prefix    the reserved prefix, e.g. {@code vispy}
     * @param separator the separator following the prefix, e.g. {@code _}
     */
    public VisualMetadataExtractor(String prefix, String separator) {
        this.marker = Objects.requireNonNull(prefix, "prefix") + Objects.requireNonNull(separator, "separator");
    }

    /**
     * @return the rendering hints of the element keyed by their stripped names, in attribute order
     */
    public Map<String, AttributeValue> extract(ElementNode geom) {
        var metadata = new LinkedHashMap<String, AttributeValue>();
        geom.attributes().forEach((key, value) -> {
            if (isVisual(key)) {
                metadata.put(strip(key), value);
            }
        });
        return Collections.unmodifiableMap(metadata);
    }

    public boolean isVisual(String attribute) {
        return attribute.length() > marker.length() && attribute.startsWith(marker);
    }

    public String strip(String attribute) {
        if (!isVisual(attribute)) {
            throw new IllegalArgumentException("Not a visual attribute: " + attribute);
        }
        return attribute.substring(marker.length());
    }
}
