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
package com.hellblazer.kinetree.loader.schema;

/**
 * Attribute names understood by the loader.
 *
 * @author hal.hildebrand
 */
public enum Attribute {
    MODEL("model"),
    GRAVITY("gravity"),
    DT("dt"),
    NAME("name"),
    POS("pos"),
    QUAT("quat"),
    EULER("euler"),
    JOINT("joint"),
    ARMATURE("armature"),
    DAMPING("damping"),
    TYPE("type"),
    MASS("mass"),
    DIM("dim");

    private final String key;

    Attribute(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
