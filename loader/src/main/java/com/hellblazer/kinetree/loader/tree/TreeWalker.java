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
package com.hellblazer.kinetree.loader.tree;

import com.hellblazer.kinetree.geometry.OrientationMath;
import com.hellblazer.kinetree.geometry.Orientations;
import com.hellblazer.kinetree.geometry.Transform;
import com.hellblazer.kinetree.loader.KinematicTreeException.ConflictingOrientation;
import com.hellblazer.kinetree.loader.KinematicTreeException.DuplicateLinkName;
import com.hellblazer.kinetree.loader.KinematicTreeException.MalformedAttribute;
import com.hellblazer.kinetree.loader.KinematicTreeException.UnknownGeomShape;
import com.hellblazer.kinetree.loader.KinematicTreeException.UnknownJointType;
import com.hellblazer.kinetree.loader.attribute.VisualMetadataExtractor;
import com.hellblazer.kinetree.loader.document.ElementNode;
import com.hellblazer.kinetree.loader.model.GeomShape;
import com.hellblazer.kinetree.loader.model.Geometry;
import com.hellblazer.kinetree.loader.model.JointType;
import com.hellblazer.kinetree.loader.model.Link;
import com.hellblazer.kinetree.loader.schema.Attribute;
import com.hellblazer.kinetree.loader.schema.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Depth first, pre-order walk of the body hierarchy under the world. Each body becomes a {@link Link} with the next
 * sequential id, so ids are dense and every parent id is smaller than its children's.
 * <p>
 * The walk uses an explicit stack rather than recursion, so the depth of the body hierarchy is not limited by the
 * call stack.
 *
 * @author hal.hildebrand
 */
public class TreeWalker {

    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    private final OrientationMath         orientationMath;
    private final VisualMetadataExtractor visual;
    private final boolean                 uniqueNames;

    /**
     * @param orientationMath converts euler angles to quaternions
     * @param visual          extracts rendering hints from geometries
     * @param uniqueNames     whether a repeated body name is an error
     */
    public TreeWalker(OrientationMath orientationMath, VisualMetadataExtractor visual, boolean uniqueNames) {
        this.orientationMath = orientationMath;
        this.visual = visual;
        this.uniqueNames = uniqueNames;
    }

    /**
     * @param worldbody the world section, already coerced and merged with defaults
     * @return the links in id order
     */
    public List<Link> walk(ElementNode worldbody) {
        var context = new TraversalContext();
        var stack = new ArrayDeque<Pending>();
        pushChildren(stack, worldbody, -1);
        while (!stack.isEmpty()) {
            var pending = stack.pop();
            var link = visit(pending.body(), pending.parent(), context);
            pushChildren(stack, pending.body(), link.id());
        }
        log.debug("Walked {} links", context.links().size());
        return context.links();
    }

    Geometry geometry(ElementNode geom) {
        var type = geom.requireText(Attribute.TYPE);
        var shape = GeomShape.forKey(type).orElseThrow(() -> new UnknownGeomShape(geom.path(), type));
        var mass = geom.requireScalar(Attribute.MASS);
        var pos = new Vector3d(geom.requireVector(Attribute.POS, 3));
        var dim = geom.requireVector(Attribute.DIM, shape.dimensions());
        return shape.create(mass, pos, dim, visual.extract(geom));
    }

    Quat4d orientation(ElementNode body) {
        var quat = body.vector(Attribute.QUAT, 4);
        var euler = body.vector(Attribute.EULER, 3);
        if (quat.isPresent() && euler.isPresent()) {
            throw new ConflictingOrientation(body.path());
        }
        if (quat.isPresent()) {
            return Transform.of(new double[3], quat.get()).rotation();
        }
        return euler.map(degrees -> orientationMath.fromEuler(Orientations.degreesToRadians(degrees)))
                    .orElseGet(Orientations::identity);
    }

    /**
     * Damping or armature of a link: zeros when absent, a single value broadcast across every degree of freedom,
     * otherwise exactly one value per degree of freedom.
     */
    double[] perDof(ElementNode body, Attribute attribute, JointType jointType) {
        var dof = jointType.dof();
        var values = body.vector(attribute).orElseGet(() -> new double[dof]);
        if (values.length == dof) {
            return values;
        }
        if (values.length == 1) {
            var broadcast = new double[dof];
            Arrays.fill(broadcast, values[0]);
            return broadcast;
        }
        throw new MalformedAttribute(body.path(), attribute.key(),
                                     "requires 1 or " + dof + " numbers for joint '" + jointType + "', got "
                                     + values.length);
    }

    private void pushChildren(ArrayDeque<Pending> stack, ElementNode parent, int parentId) {
        var bodies = parent.children(Tag.BODY.key());
        // reverse, so the first body in document order is popped first
        for (int i = bodies.size() - 1; i >= 0; i--) {
            stack.push(new Pending(bodies.get(i), parentId));
        }
    }

    private Link visit(ElementNode body, int parent, TraversalContext context) {
        var name = body.requireText(Attribute.NAME);
        var jointKey = body.requireText(Attribute.JOINT);
        var jointType = JointType.forKey(jointKey).orElseThrow(() -> new UnknownJointType(body.path(), jointKey));
        if (uniqueNames) {
            context.nameOwner(name).ifPresent(owner -> {
                throw new DuplicateLinkName(body.path(), name, owner);
            });
        }

        var position = body.vector(Attribute.POS, 3).orElseGet(() -> new double[3]);
        var transform = new Transform(new Vector3d(position), orientation(body));
        var damping = perDof(body, Attribute.DAMPING, jointType);
        var armature = perDof(body, Attribute.ARMATURE, jointType);

        var geoms = new ArrayList<Geometry>();
        for (var geom : body.children(Tag.GEOM.key())) {
            geoms.add(geometry(geom));
        }

        var link = new Link(context.nextId(), parent, name, jointType, transform, damping, armature, geoms);
        context.add(link);
        log.trace("Link {} '{}' parent={} joint={} geoms={}", link.id(), name, parent, jointType, geoms.size());
        return link;
    }

    private record Pending(ElementNode body, int parent) {
    }
}
