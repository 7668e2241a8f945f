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
package com.hellblazer.kinetree.loader.schema;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.hellblazer.kinetree.loader.schema.Attribute.*;

/**
 * The closed set of element tags and the attributes each one accepts. The document root has no fixed tag name; its
 * name is configured and matched by {@link #resolve(String, String)}.
 *
 * @author hal.hildebrand
 */
public enum Tag {
    ROOT(null, MODEL),
    OPTIONS("options", GRAVITY, DT),
    DEFAULTS("defaults"),
    WORLDBODY("worldbody"),
    BODY("body", NAME, POS, QUAT, EULER, JOINT, ARMATURE, DAMPING),
    GEOM("geom", TYPE, MASS, POS, DIM);

    private final String      key;
    private final Set<String> attributeKeys;

    Tag(String key, Attribute... attributes) {
        this.key = key;
        this.attributeKeys = Arrays.stream(attributes).map(Attribute::key).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @return true if the name is one of the fixed element names, which cannot serve as the root's name
     */
    public static boolean isReserved(String name) {
        for (var tag : values()) {
            if (tag.key != null && tag.key.equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Map an element name to its tag
     *
     * @param name    the element name as written
     * @param rootTag the configured name of the document root
     * @return the tag, or empty if the name is not part of the schema
     */
    public static Optional<Tag> resolve(String name, String rootTag) {
        if (name.equals(rootTag)) {
            return Optional.of(ROOT);
        }
        for (var tag : values()) {
            if (tag.key != null && tag.key.equals(name)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    public boolean allows(String attribute) {
        return attributeKeys.contains(attribute);
    }

    /**
     * @return the element name, or null for {@link #ROOT} whose name is configurable
     */
    public String key() {
        return key;
    }
}
