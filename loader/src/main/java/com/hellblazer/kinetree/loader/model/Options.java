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

import javax.vecmath.Vector3d;

/**
 * Global simulation options.
 *
 * @param gravity gravitational acceleration in the world frame
 * @param dt      integration time step, strictly positive
 * @author hal.hildebrand
 */
public record Options(Vector3d gravity, double dt) {

    public Options {
        if (!(dt > 0)) {
            throw new IllegalArgumentException("Time step must be positive: " + dt);
        }
        gravity = new Vector3d(gravity);
    }

    @Override
    public Vector3d gravity() {
        return new Vector3d(gravity);
    }
}
