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

import com.hellblazer.kinetree.loader.document.ElementNode;
import com.hellblazer.kinetree.loader.schema.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills the bodies and geometries of the world with the declared defaults. Only absent attributes are filled;
 * explicit values always win, which also makes a repeated merge a no-op.
 *
 * @author hal.hildebrand
 */
public final class DefaultsResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultsResolver.class);

    private DefaultsResolver() {
    }

    /**
     * @param worldbody the world section; the section itself carries no defaults, only its descendants
     * @param defaults  the declared defaults
     * @return the number of attributes injected
     */
    public static int apply(ElementNode worldbody, DefaultsTable defaults) {
        if (defaults.isEmpty()) {
            log.debug("No defaults declared");
            return 0;
        }
        var injected = 0;
        for (var node : worldbody.preOrder()) {
            if (node == worldbody) {
                continue;
            }
            var tag = node.name().equals(Tag.BODY.key()) ? Tag.BODY
                                                         : node.name().equals(Tag.GEOM.key()) ? Tag.GEOM : null;
            if (tag == null) {
                continue;
            }
            for (var entry : defaults.forTag(tag).entrySet()) {
                if (!node.attributes().containsKey(entry.getKey())) {
                    node.putIfAbsent(entry.getKey(), entry.getValue());
                    injected++;
                }
            }
        }
        log.debug("Injected {} default attribute values", injected);
        return injected;
    }
}
