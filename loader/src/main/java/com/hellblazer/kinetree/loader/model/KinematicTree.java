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

import java.util.*;
import java.util.stream.IntStream;

/**
 * Flattened kinematic tree. Links are indexed 0..N-1 in pre-order, so every link's parent precedes it. Per link data
 * is held in parallel sequences; damping and armature are concatenated in link order into flat vectors, each link
 * owning a {@code jointType.dof()} wide slice starting at {@link #qdOffset(int)}.
 * <p>
 * Instances are immutable.
 *
 * @author hal.hildebrand
 */
public final class KinematicTree {

    private final int[]                parents;
    private final List<JointType>      jointTypes;
    private final List<String>         names;
    private final List<Transform>      transforms;
    private final List<List<Geometry>> geoms;
    private final double[]             dampings;
    private final double[]             armatures;
    private final Options              options;
    private final Optional<String>     model;
    private final int[]                qdOffsets;
    private final Map<String, Integer> index;

    public KinematicTree(int[] parents, List<JointType> jointTypes, List<String> names, List<Transform> transforms,
                         List<List<Geometry>> geoms, double[] dampings, double[] armatures, Options options,
                         Optional<String> model) {
        var n = parents.length;
        if (jointTypes.size() != n || names.size() != n || transforms.size() != n || geoms.size() != n) {
            throw new IllegalArgumentException(
            "Per link sequences differ in length: parents=" + n + ", jointTypes=" + jointTypes.size() + ", names="
            + names.size() + ", transforms=" + transforms.size() + ", geoms=" + geoms.size());
        }
        this.parents = parents.clone();
        this.jointTypes = List.copyOf(jointTypes);
        this.names = List.copyOf(names);
        this.transforms = List.copyOf(transforms);
        this.geoms = geoms.stream().map(List::copyOf).toList();
        this.options = Objects.requireNonNull(options, "options");
        this.model = Objects.requireNonNull(model, "model");

        qdOffsets = new int[n + 1];
        for (int i = 0; i < n; i++) {
            qdOffsets[i + 1] = qdOffsets[i] + this.jointTypes.get(i).dof();
        }
        if (dampings.length != qdOffsets[n] || armatures.length != qdOffsets[n]) {
            throw new IllegalArgumentException(
            "Damping and armature must total " + qdOffsets[n] + " entries, got " + dampings.length + " and "
            + armatures.length);
        }
        this.dampings = dampings.clone();
        this.armatures = armatures.clone();

        var byName = new HashMap<String, Integer>();
        for (int i = n - 1; i >= 0; i--) {
            byName.put(this.names.get(i), i);
        }
        index = Collections.unmodifiableMap(byName);
    }

    public double[] armature(int link) {
        return Arrays.copyOfRange(armatures, qdOffset(link), qdOffsets[link + 1]);
    }

    public double[] armatures() {
        return armatures.clone();
    }

    /**
     * @return ids of the direct children of the link, ascending
     */
    public int[] children(int link) {
        checkLink(link);
        return IntStream.range(link + 1, parents.length).filter(i -> parents[i] == link).toArray();
    }

    public double[] damping(int link) {
        return Arrays.copyOfRange(dampings, qdOffset(link), qdOffsets[link + 1]);
    }

    public double[] dampings() {
        return dampings.clone();
    }

    public List<Geometry> geoms(int link) {
        checkLink(link);
        return geoms.get(link);
    }

    public List<List<Geometry>> geoms() {
        return geoms;
    }

    /**
     * @return the id of the first link with the name, if any
     */
    public OptionalInt indexOf(String name) {
        var i = index.get(name);
        return i == null ? OptionalInt.empty() : OptionalInt.of(i);
    }

    public JointType jointType(int link) {
        checkLink(link);
        return jointTypes.get(link);
    }

    public List<JointType> jointTypes() {
        return jointTypes;
    }

    /**
     * @return the value of the root element's {@code model} attribute, if given
     */
    public Optional<String> model() {
        return model;
    }

    public String name(int link) {
        checkLink(link);
        return names.get(link);
    }

    public List<String> names() {
        return names;
    }

    public Options options() {
        return options;
    }

    public int parent(int link) {
        checkLink(link);
        return parents[link];
    }

    public int[] parents() {
        return parents.clone();
    }

    /**
     * @return the total width of the generalized coordinates
     */
    public int qSize() {
        return jointTypes.stream().mapToInt(JointType::qWidth).sum();
    }

    /**
     * @return the start of the link's slice in {@link #dampings()} and {@link #armatures()}
     */
    public int qdOffset(int link) {
        checkLink(link);
        return qdOffsets[link];
    }

    /**
     * @return the total degrees of freedom, which is the length of the damping and armature vectors
     */
    public int qdSize() {
        return qdOffsets[parents.length];
    }

    /**
     * @return ids of the links attached to the world, ascending
     */
    public int[] roots() {
        return IntStream.range(0, parents.length).filter(i -> parents[i] == -1).toArray();
    }

    public int size() {
        return parents.length;
    }

    public Transform transform(int link) {
        checkLink(link);
        return transforms.get(link);
    }

    public List<Transform> transforms() {
        return transforms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KinematicTree other)) {
            return false;
        }
        return Arrays.equals(parents, other.parents) && jointTypes.equals(other.jointTypes) && names.equals(
        other.names) && transforms.equals(other.transforms) && geoms.equals(other.geoms) && Arrays.equals(dampings,
        other.dampings) && Arrays.equals(armatures, other.armatures) && options.equals(other.options) && model.equals(
        other.model);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(parents), jointTypes, names, transforms, geoms, Arrays.hashCode(dampings),
                            Arrays.hashCode(armatures), options, model);
    }

    @Override
    public String toString() {
        return "KinematicTree{" + model.orElse("unnamed") + ", links=" + names + ", parents=" + Arrays.toString(parents)
        + ", qd=" + qdSize() + "}";
    }

    private void checkLink(int link) {
        if (link < 0 || link >= parents.length) {
            throw new IndexOutOfBoundsException("Link:" + link + ", Size:" + parents.length);
        }
    }
}
