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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rigid geometry attached to a link. Positions are relative to the owning link's frame. The visual metadata is opaque
 * to the loader and handed to whatever renders the model.
 *
 * @author hal.hildebrand
 */
public sealed interface Geometry permits Geometry.Box, Geometry.Sphere, Geometry.Cylinder {

    private static Map<String, AttributeValue> copy(Map<String, AttributeValue> visual) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(visual));
    }

    /**
     * @return the shape specific dimensions, in the order they are declared
     */
    double[] dimensions();

    Vector3d localPosition();

    double mass();

    GeomShape shape();

    Map<String, AttributeValue> visualMetadata();

    record Box(double mass, Vector3d localPosition, double dimX, double dimY, double dimZ,
               Map<String, AttributeValue> visualMetadata) implements Geometry {
        public Box {
            localPosition = new Vector3d(localPosition);
            visualMetadata = copy(visualMetadata);
        }

        @Override
        public double[] dimensions() {
            return new double[] { dimX, dimY, dimZ };
        }

        @Override
        public Vector3d localPosition() {
            return new Vector3d(localPosition);
        }

        @Override
        public GeomShape shape() {
            return GeomShape.BOX;
        }
    }

    record Sphere(double mass, Vector3d localPosition, double radius, Map<String, AttributeValue> visualMetadata)
    implements Geometry {
        public Sphere {
            localPosition = new Vector3d(localPosition);
            visualMetadata = copy(visualMetadata);
        }

        @Override
        public double[] dimensions() {
            return new double[] { radius };
        }

        @Override
        public Vector3d localPosition() {
            return new Vector3d(localPosition);
        }

        @Override
        public GeomShape shape() {
            return GeomShape.SPHERE;
        }
    }

    record Cylinder(double mass, Vector3d localPosition, double radius, double length,
                    Map<String, AttributeValue> visualMetadata) implements Geometry {
        public Cylinder {
            localPosition = new Vector3d(localPosition);
            visualMetadata = copy(visualMetadata);
        }

        @Override
        public double[] dimensions() {
            return new double[] { radius, length };
        }

        @Override
        public Vector3d localPosition() {
            return new Vector3d(localPosition);
        }

        @Override
        public GeomShape shape() {
            return GeomShape.CYLINDER;
        }
    }
}
