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

import com.hellblazer.kinetree.common.DoubleArrayList;
import com.hellblazer.kinetree.geometry.Transform;
import com.hellblazer.kinetree.loader.KinematicTreeException.NonContiguousIds;
import com.hellblazer.kinetree.loader.model.Geometry;
import com.hellblazer.kinetree.loader.model.JointType;
import com.hellblazer.kinetree.loader.model.KinematicTree;
import com.hellblazer.kinetree.loader.model.Link;
import com.hellblazer.kinetree.loader.model.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the walked links into the parallel sequences of a {@link KinematicTree}, concatenating damping and armature
 * in link order.
 *
 * @author hal.hildebrand
 */
public final class TreeFlattener {

    private static final Logger log = LoggerFactory.getLogger(TreeFlattener.class);

    private TreeFlattener() {
    }

    /**
     * @param links   the links, which must carry ids 0..N-1 in order, each parent preceding its children
     * @param options the global options
     * @param model   the model name, if any
     * @throws NonContiguousIds if the links violate the id ordering
     */
    public static KinematicTree flatten(List<Link> links, Options options, Optional<String> model) {
        var n = links.size();
        var parents = new int[n];
        var jointTypes = new ArrayList<JointType>(n);
        var names = new ArrayList<String>(n);
        var transforms = new ArrayList<Transform>(n);
        var geoms = new ArrayList<List<Geometry>>(n);
        var dampings = new DoubleArrayList();
        var armatures = new DoubleArrayList();

        for (int i = 0; i < n; i++) {
            var link = links.get(i);
            if (link.id() != i) {
                throw new NonContiguousIds("link at position " + i + " carries id " + link.id());
            }
            if (link.parent() < -1 || link.parent() >= i) {
                throw new NonContiguousIds(
                "link " + i + " has parent " + link.parent() + ", which does not precede it");
            }
            parents[i] = link.parent();
            jointTypes.add(link.jointType());
            names.add(link.name());
            transforms.add(link.transform());
            geoms.add(link.geoms());
            dampings.addAll(link.damping());
            armatures.addAll(link.armature());
        }

        var tree = new KinematicTree(parents, jointTypes, names, transforms, geoms, dampings.toArray(),
                                     armatures.toArray(), options, model);
        log.debug("Flattened {} links, {} degrees of freedom", n, tree.qdSize());
        return tree;
    }
}
