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
package com.hellblazer.kinetree.loader.tree;

import com.hellblazer.kinetree.loader.model.Link;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * State of one traversal: the id counter and the links visited so far, in visit order. Created fresh for every load
 * and never shared.
 *
 * @author hal.hildebrand
 */
final class TraversalContext {

    private final List<Link>           links = new ArrayList<>();
    private final Map<String, Integer> names = new HashMap<>();
    private       int                  next  = 0;

    void add(Link link) {
        links.add(link);
        names.putIfAbsent(link.name(), link.id());
    }

    List<Link> links() {
        return Collections.unmodifiableList(links);
    }

    /**
     * @return the id of the link already using the name, if any
     */
    OptionalInt nameOwner(String name) {
        var owner = names.get(name);
        return owner == null ? OptionalInt.empty() : OptionalInt.of(owner);
    }

    int nextId() {
        return next++;
    }
}
