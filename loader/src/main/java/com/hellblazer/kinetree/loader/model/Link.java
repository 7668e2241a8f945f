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
package com.hellblazer.kinetree.loader.model;

import com.hellblazer.kinetree.geometry.Transform;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One body of the tree together with the joint connecting it to its parent.
 *
 * @param id        pre-order index of the link
 * @param parent    id of the parent link, -1 for links attached to the world
 * @param name      name of the link, unique unless the loader is permissive
 * @param jointType joint to the parent
 * @param transform pose relative to the parent
 * @param damping   per degree of freedom damping, {@code jointType.dof()} long
 * @param armature  per degree of freedom armature, {@code jointType.dof()} long
 * @param geoms     owned geometry in document order
 * @author hal.hildebrand
 */
public record Link(int id, int parent, String name, JointType jointType, Transform transform, double[] damping,
                   double[] armature, List<Geometry> geoms) {

    public Link {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(jointType, "jointType");
        Objects.requireNonNull(transform, "transform");
        if (damping.length != jointType.dof() || armature.length != jointType.dof()) {
            throw new IllegalArgumentException(
            "Link " + name + ": damping and armature must have " + jointType.dof() + " entries, got "
            + damping.length + " and " + armature.length);
        }
        damping = damping.clone();
        armature = armature.clone();
        geoms = List.copyOf(geoms);
    }

    @Override
    public double[] armature() {
        return armature.clone();
    }

    @Override
    public double[] damping() {
        return damping.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Link other)) {
            return false;
        }
        return id == other.id && parent == other.parent && name.equals(other.name) && jointType == other.jointType
        && transform.equals(other.transform) && Arrays.equals(damping, other.damping) && Arrays.equals(armature,
                                                                                                       other.armature)
        && geoms.equals(other.geoms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, parent, name, jointType, transform, Arrays.hashCode(damping),
                            Arrays.hashCode(armature), geoms);
    }

    @Override
    public String toString() {
        return "Link{" + id + ":" + name + ", parent=" + parent + ", joint=" + jointType + ", " + transform + ", geoms="
        + geoms.size() + "}";
    }
}
