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

/**
 * Conversion from Euler angles to rotation quaternions.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface OrientationMath {

    /**
     * @param radians the three rotation angles about x, y and z, in radians
     * @return the unit quaternion for the rotation
     */
    Quat4d fromEuler(double[] radians);
}
