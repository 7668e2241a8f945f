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

import com.hellblazer.kinetree.loader.KinematicTreeException.SchemaViolation;
import com.hellblazer.kinetree.loader.attribute.VisualMetadataExtractor;
import com.hellblazer.kinetree.loader.document.ElementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Whitelist check over the whole document: every element must be a known {@link Tag} and every attribute must be
 * registered for that tag. Rendering hints on geometries are exempt. Runs before any value is interpreted.
 *
 * @author hal.hildebrand
 */
public final class AttributeSchema {

    private static final Logger log = LoggerFactory.getLogger(AttributeSchema.class);

    private final String                  rootTag;
    private final VisualMetadataExtractor visual;

    public AttributeSchema(String rootTag, VisualMetadataExtractor visual) {
        this.rootTag = rootTag;
        this.visual = visual;
    }

    /**
     * @throws SchemaViolation on the first unknown tag or attribute, in document order
     */
    public void validate(ElementNode root) {
        var checked = 0;
        for (var node : root.preOrder()) {
            var tag = Tag.resolve(node.name(), rootTag)
                         .orElseThrow(() -> new SchemaViolation(node.path(), node.name(), null));
            for (var attribute : node.attributes().keySet()) {
                if (tag == Tag.GEOM && visual.isVisual(attribute)) {
                    continue;
                }
                if (!tag.allows(attribute)) {
                    throw new SchemaViolation(node.path(), node.name(), attribute);
                }
            }
            checked++;
        }
        log.debug("Schema check passed for {} elements", checked);
    }
}
