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

import javax.vecmath.AxisAngle4d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

/**
 * Euler angle support. Angles are always indexed by axis (x, y, z); the {@link RotationOrder} selects the sequence
 * in which the intrinsic rotations are composed.
 *
 * @author hal.hildebrand
 */
public final class Orientations {

    public enum PrincipalAxis {
        X(new Vector3d(1, 0, 0)), Y(new Vector3d(0, 1, 0)), Z(new Vector3d(0, 0, 1));

        private final Vector3d unit;

        PrincipalAxis(Vector3d unit) {
            this.unit = unit;
        }

        /**
         * @param theta - the radians of rotation about the axis
         * @return the unit quaternion rotating by theta about the receiver
         */
        public Quat4d radians(double theta) {
            var q = new Quat4d();
            q.set(new AxisAngle4d(unit, theta));
            return q;
        }

        int index() {
            return ordinal();
        }
    }

    /**
     * Order of intrinsic rotations: XYZ rotates about x, then about the rotated y, then about the twice rotated z.
     */
    public enum RotationOrder {
        XYZ(PrincipalAxis.X, PrincipalAxis.Y, PrincipalAxis.Z),
        XZY(PrincipalAxis.X, PrincipalAxis.Z, PrincipalAxis.Y),
        YXZ(PrincipalAxis.Y, PrincipalAxis.X, PrincipalAxis.Z),
        YZX(PrincipalAxis.Y, PrincipalAxis.Z, PrincipalAxis.X),
        ZXY(PrincipalAxis.Z, PrincipalAxis.X, PrincipalAxis.Y),
        ZYX(PrincipalAxis.Z, PrincipalAxis.Y, PrincipalAxis.X);

        private final PrincipalAxis[] sequence;

        RotationOrder(PrincipalAxis... sequence) {
            this.sequence = sequence;
        }
    }

    private static final double DEG_TO_RAD = Math.PI / 180.0;

    private Orientations() {
    }

    public static double[] degreesToRadians(double[] degrees) {
        var radians = new double[degrees.length];
        for (int i = 0; i < degrees.length; i++) {
            radians[i] = degrees[i] * DEG_TO_RAD;
        }
        return radians;
    }

    /**
     * @return the identity rotation, w = 1
     */
    public static Quat4d identity() {
        var q = new Quat4d();
        q.w = 1.0;
        return q;
    }

    /**
     * The default conversion used by the loader: x, then y, then z, intrinsic.
     */
    public static OrientationMath intrinsicXyz() {
        return of(RotationOrder.XYZ);
    }

    public static OrientationMath of(RotationOrder order) {
        return radians -> {
            if (radians.length != 3) {
                throw new IllegalArgumentException("Euler rotation requires 3 angles, got " + radians.length);
            }
            var result = identity();
            for (var axis : order.sequence) {
                result.mul(axis.radians(radians[axis.index()]));
            }
            result.normalize();
            return result;
        };
    }
}
