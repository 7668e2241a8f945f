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
package com.hellblazer.kinetree.loader;

/**
 * Sealed exception hierarchy for kinematic tree loading. Every failure aborts the whole load; no partial tree is
 * ever returned.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link MalformedDocument} - text is not well formed, or could not be read</li>
 * <li>{@link StructuralViolation} - required singleton missing or duplicated, element out of place</li>
 * <li>{@link SchemaViolation} - unknown tag, or attribute outside the tag's whitelist</li>
 * <li>{@link MalformedAttribute} - required attribute missing, not numeric, or of the wrong arity</li>
 * <li>{@link ConflictingOrientation} - both quat and euler given on one body</li>
 * <li>{@link UnknownJointType} - joint kind outside the known set</li>
 * <li>{@link UnknownGeomShape} - geometry kind outside the known set</li>
 * <li>{@link DuplicateLinkName} - two bodies share a name</li>
 * <li>{@link NonContiguousIds} - link ids are not 0..N-1 in pre-order</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class KinematicTreeException extends RuntimeException
permits KinematicTreeException.MalformedDocument, KinematicTreeException.StructuralViolation,
KinematicTreeException.SchemaViolation, KinematicTreeException.MalformedAttribute,
KinematicTreeException.ConflictingOrientation, KinematicTreeException.UnknownJointType,
KinematicTreeException.UnknownGeomShape, KinematicTreeException.DuplicateLinkName,
KinematicTreeException.NonContiguousIds {

    private final String path;

    /**
     * @param path    the path of the offending element, e.g. {@code x_xy/worldbody/body[a]}
     * @param message the detail message
     */
    public KinematicTreeException(String path, String message) {
        super(path == null ? message : path + ": " + message);
        this.path = path;
    }

    public KinematicTreeException(String path, String message, Throwable cause) {
        super(path == null ? message : path + ": " + message, cause);
        this.path = path;
    }

    /**
     * @return the path of the offending element, or null when the failure is not tied to one element
     */
    public String getPath() {
        return path;
    }

    /**
     * The document text is not well formed, or the file or resource holding it could not be read.
     */
    public static final class MalformedDocument extends KinematicTreeException {
        public MalformedDocument(String source, String message, Throwable cause) {
            super(source, message, cause);
        }
    }

    public static final class StructuralViolation extends KinematicTreeException {
        public StructuralViolation(String path, String message) {
            super(path, message);
        }
    }

    public static final class SchemaViolation extends KinematicTreeException {
        private final String tag;
        private final String attribute;

        public SchemaViolation(String path, String tag, String attribute) {
            super(path, attribute == null ? "unknown tag <" + tag + ">"
                                          : "attribute '" + attribute + "' is not allowed on <" + tag + ">");
            this.tag = tag;
            this.attribute = attribute;
        }

        /**
         * @return the offending attribute, or null if the tag itself is unknown
         */
        public String getAttribute() {
            return attribute;
        }

        public String getTag() {
            return tag;
        }
    }

    public static final class MalformedAttribute extends KinematicTreeException {
        private final String attribute;

        public MalformedAttribute(String path, String attribute, String message) {
            super(path, "attribute '" + attribute + "' " + message);
            this.attribute = attribute;
        }

        public String getAttribute() {
            return attribute;
        }
    }

    public static final class ConflictingOrientation extends KinematicTreeException {
        public ConflictingOrientation(String path) {
            super(path, "both 'quat' and 'euler' are given, at most one is allowed");
        }
    }

    public static final class UnknownJointType extends KinematicTreeException {
        private final String jointType;

        public UnknownJointType(String path, String jointType) {
            super(path, "unknown joint type '" + jointType + "'");
            this.jointType = jointType;
        }

        public String getJointType() {
            return jointType;
        }
    }

    public static final class UnknownGeomShape extends KinematicTreeException {
        private final String shape;

        public UnknownGeomShape(String path, String shape) {
            super(path, "unknown geometry type '" + shape + "'");
            this.shape = shape;
        }

        public String getShape() {
            return shape;
        }
    }

    public static final class DuplicateLinkName extends KinematicTreeException {
        private final String name;

        public DuplicateLinkName(String path, String name, int firstId) {
            super(path, "link name '" + name + "' is already used by link " + firstId);
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    /**
     * Link ids were not assigned densely in pre-order. Indicates a traversal bug rather than bad input.
     */
    public static final class NonContiguousIds extends KinematicTreeException {
        public NonContiguousIds(String message) {
            super(null, message);
        }
    }
}
