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

import com.hellblazer.kinetree.geometry.Transform;
import com.hellblazer.kinetree.loader.KinematicTreeException.NonContiguousIds;
import com.hellblazer.kinetree.loader.model.Geometry;
import com.hellblazer.kinetree.loader.model.JointType;
import com.hellblazer.kinetree.loader.model.Link;
import com.hellblazer.kinetree.loader.model.Options;
import org.junit.jupiter.api.Test;

import javax.vecmath.Vector3d;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TreeFlattenerTest {

    private static final Options OPTIONS = new Options(new Vector3d(0, 0, -9.81), 0.01);

    private static Link link(int id, int parent, JointType joint, double damping) {
        var dof = new double[joint.dof()];
        Arrays.fill(dof, damping);
        return new Link(id, parent, "l" + id, joint, Transform.identity(), dof, new double[joint.dof()], List.of());
    }

    @Test
    public void concatenatesInLinkOrder() {
        var sphere = new Geometry.Sphere(1, new Vector3d(), 0.5, Map.of());
        var links = List.of(link(0, -1, JointType.SPHERICAL, 1), link(1, 0, JointType.FROZEN, 9),
                            new Link(2, 0, "l2", JointType.PX, Transform.identity(), new double[] { 3 },
                                     new double[] { 4 }, List.of(sphere)));

        var tree = TreeFlattener.flatten(links, OPTIONS, Optional.of("m"));
        assertArrayEquals(new int[] { -1, 0, 0 }, tree.parents());
        assertArrayEquals(new double[] { 1, 1, 1, 3 }, tree.dampings());
        assertArrayEquals(new double[] { 0, 0, 0, 4 }, tree.armatures());
        assertEquals(List.of(List.of(), List.of(), List.of(sphere)), tree.geoms());
        assertEquals(Optional.of("m"), tree.model());
        assertEquals(OPTIONS, tree.options());
    }

    @Test
    public void empty() {
        var tree = TreeFlattener.flatten(List.of(), OPTIONS, Optional.empty());
        assertEquals(0, tree.size());
        assertEquals(0, tree.dampings().length);
        assertEquals(0, tree.roots().length);
    }

    @Test
    public void idsOutOfOrder() {
        var links = List.of(link(0, -1, JointType.RX, 0), link(2, 0, JointType.RX, 0));
        assertThrows(NonContiguousIds.class, () -> TreeFlattener.flatten(links, OPTIONS, Optional.empty()));
    }

    @Test
    public void parentAfterChild() {
        var links = List.of(link(0, 1, JointType.RX, 0), link(1, -1, JointType.RX, 0));
        var e = assertThrows(NonContiguousIds.class, () -> TreeFlattener.flatten(links, OPTIONS, Optional.empty()));
        assertNull(e.getPath());
        assertThrows(NonContiguousIds.class, () -> TreeFlattener.flatten(List.of(link(0, -2, JointType.RX, 0)),
                                                                         OPTIONS, Optional.empty()));
    }
}
