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
package com.hellblazer.kinetree.loader.defaults;

import com.hellblazer.kinetree.loader.attribute.AttributeValue;
import com.hellblazer.kinetree.loader.document.DocumentStructure;
import com.hellblazer.kinetree.loader.document.ElementNode;
import com.hellblazer.kinetree.loader.schema.Tag;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Default attribute values per tag, as declared by the optional {@code defaults} section. A missing section, or a
 * missing entry for a tag, means no defaults for that tag.
 *
 * @author hal.hildebrand
 */
public record DefaultsTable(Map<String, AttributeValue> geom, Map<String, AttributeValue> body) {

    private static final DefaultsTable EMPTY = new DefaultsTable(Map.of(), Map.of());

    public DefaultsTable {
        geom = Collections.unmodifiableMap(new LinkedHashMap<>(geom));
        body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    public static DefaultsTable empty() {
        return EMPTY;
    }

    /**
     * Capture the defaults section. Values are taken as they stand, so call this after numeric coercion for defaults
     * and explicit values to share one representation.
     */
    public static DefaultsTable from(Optional<ElementNode> defaults) {
        return defaults.map(d -> new DefaultsTable(attributesOf(d, Tag.GEOM), attributesOf(d, Tag.BODY)))
                       .orElseGet(DefaultsTable::empty);
    }

    private static Map<String, AttributeValue> attributesOf(ElementNode defaults, Tag tag) {
        return DocumentStructure.unique(defaults, tag.key()).map(ElementNode::attributes).orElse(Map.of());
    }

    /**
     * @return the defaults for the tag; empty for tags that cannot carry defaults
     */
    public Map<String, AttributeValue> forTag(Tag tag) {
        return switch (tag) {
            case GEOM -> geom;
            case BODY -> body;
            default -> Map.of();
        };
    }

    public boolean isEmpty() {
        return geom.isEmpty() && body.isEmpty();
    }
}
