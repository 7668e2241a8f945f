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

import java.util.Optional;

/**
 * Joint kinds connecting a link to its parent, with the widths of their generalized coordinates ({@code q}) and
 * velocities ({@code qd}). The velocity width is the degree of freedom count, which sizes the damping and armature
 * vectors of a link.
 *
 * @author hal.hildebrand
 */
public enum JointType {
    FREE("free", 7, 6),
    FROZEN("frozen", 0, 0),
    SPHERICAL("spherical", 4, 3),
    P3D("p3d", 3, 3),
    COR("cor", 10, 9),
    PX("px", 1, 1),
    PY("py", 1, 1),
    PZ("pz", 1, 1),
    RX("rx", 1, 1),
    RY("ry", 1, 1),
    RZ("rz", 1, 1),
    HINGE("hinge", 1, 1),
    SLIDER("slider", 1, 1);

    private final String key;
    private final int    qWidth;
    private final int    qdWidth;

    JointType(String key, int qWidth, int qdWidth) {
        this.key = key;
        this.qWidth = qWidth;
        this.qdWidth = qdWidth;
    }

    public static Optional<JointType> forKey(String key) {
        for (var type : values()) {
            if (type.key.equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the degrees of freedom, same as {@link #qdWidth()}
     */
    public int dof() {
        return qdWidth;
    }

    public String key() {
        return key;
    }

    public int qWidth() {
        return qWidth;
    }

    public int qdWidth() {
        return qdWidth;
    }

    @Override
    public String toString() {
        return key;
    }
}
