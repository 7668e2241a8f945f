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
package com.hellblazer.kinetree.geometry;

import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

/**
 * Rigid transform of a link relative to its parent: a translation followed by a rotation. Components are copied on
 * the way in and on the way out, so instances are immutable.
 *
 * @author hal.hildebrand
 */
public record Transform(Vector3d position, Quat4d rotation) {

    public Transform {
        position = new Vector3d(position);
        rotation = new Quat4d(rotation);
    }

    public static Transform identity() {
        return new Transform(new Vector3d(), Orientations.identity());
    }

    /**
     * @param position the translation, x y z
     * @param wxyz     the rotation quaternion, scalar first
     */
    public static Transform of(double[] position, double[] wxyz) {
        if (position.length != 3) {
            throw new IllegalArgumentException("Position requires 3 components, got " + position.length);
        }
        if (wxyz.length != 4) {
            throw new IllegalArgumentException("Quaternion requires 4 components, got " + wxyz.length);
        }
        var q = new Quat4d();
        q.w = wxyz[0];
        q.x = wxyz[1];
        q.y = wxyz[2];
        q.z = wxyz[3];
        return new Transform(new Vector3d(position), q);
    }

    @Override
    public Vector3d position() {
        return new Vector3d(position);
    }

    @Override
    public Quat4d rotation() {
        return new Quat4d(rotation);
    }

    /**
     * @return the rotation as a scalar first array
     */
    public double[] wxyz() {
        return new double[] { rotation.w, rotation.x, rotation.y, rotation.z };
    }

    @Override
    public String toString() {
        return "Transform{pos=" + position + ", quat=[" + rotation.w + ", " + rotation.x + ", " + rotation.y + ", "
        + rotation.z + "]}";
    }
}
