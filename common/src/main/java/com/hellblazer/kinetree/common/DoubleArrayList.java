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
package com.hellblazer.kinetree.common;

import java.util.Arrays;
import java.util.RandomAccess;

/**
 * Growable, unboxed list of doubles. Used to concatenate per-link vectors into the flat arrays handed to the
 * simulation.
 *
 * @author hal.hildebrand
 */
public final class DoubleArrayList implements RandomAccess {

    private static final int DEFAULT_CAPACITY = 10;

    private double[] array;
    private int      size;

    public DoubleArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public DoubleArrayList(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Negative capacity: " + initialCapacity);
        }
        array = new double[initialCapacity];
    }

    /**
     * Append every element of the supplied vector, in order
     */
    public void addAll(double[] values) {
        if (values.length == 0) {
            return;
        }
        int overflow = Integer.MAX_VALUE - size;
        if (overflow < values.length) {
            // We can't actually represent a list this large.
            throw new OutOfMemoryError();
        }
        int newSize = size + values.length;
        if (newSize > array.length) {
            // Resize to at least 1.5x the size
            grow(Math.max(newSize, ((size * 3) / 2) + 1));
        }
        System.arraycopy(values, 0, array, size, values.length);
        size = newSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final DoubleArrayList other)) {
            return false;
        }
        if (size != other.size) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (Double.doubleToLongBits(array[i]) != Double.doubleToLongBits(other.array[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < size; i++) {
            result = (31 * result) + Double.hashCode(array[i]);
        }
        return result;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    /**
     * @return a copy of the live elements, exactly {@link #size()} long
     */
    public double[] toArray() {
        return Arrays.copyOf(array, size);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    private void grow(int length) {
        array = Arrays.copyOf(array, length);
    }
}
