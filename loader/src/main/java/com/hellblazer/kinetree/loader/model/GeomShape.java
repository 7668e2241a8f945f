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

import com.hellblazer.kinetree.loader.attribute.AttributeValue;

import javax.vecmath.Vector3d;
import java.util.Map;
import java.util.Optional;

/**
 * The geometry kinds a link may own, keyed by the value of the geometry's {@code type} attribute.
 *
 * @author hal.hildebrand
 */
public enum GeomShape {
    BOX("box", 3),
    SPHERE("sphere", 1),
    CYLINDER("cylinder", 2);

    private final String key;
    private final int    dimensions;

    GeomShape(String key, int dimensions) {
        this.key = key;
        this.dimensions = dimensions;
    }

    public static Optional<GeomShape> forKey(String key) {
        for (var shape : values()) {
            if (shape.key.equals(key)) {
                return Optional.of(shape);
            }
        }
        return Optional.empty();
    }

    /**
     * @param dim exactly {@link #dimensions()} values
     */
    public Geometry create(double mass, Vector3d localPosition, double[] dim, Map<String, AttributeValue> visual) {
        if (dim.length != dimensions) {
            throw new IllegalArgumentException(key + " requires " + dimensions + " dimensions, got " + dim.length);
        }
        return switch (this) {
            case BOX -> new Geometry.Box(mass, localPosition, dim[0], dim[1], dim[2], visual);
            case SPHERE -> new Geometry.Sphere(mass, localPosition, dim[0], visual);
            case CYLINDER -> new Geometry.Cylinder(mass, localPosition, dim[0], dim[1], visual);
        };
    }

    /**
     * @return the number of values the {@code dim} attribute carries for this shape
     */
    public int dimensions() {
        return dimensions;
    }

    public String key() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
