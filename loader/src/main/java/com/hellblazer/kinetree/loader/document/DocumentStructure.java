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
package com.hellblazer.kinetree.loader.document;

import com.hellblazer.kinetree.loader.KinematicTreeException.StructuralViolation;
import com.hellblazer.kinetree.loader.schema.Tag;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The singleton sections of a document, located after checking that every element sits where it may. Assumes the
 * document already passed the attribute schema, so every element name resolves to a {@link Tag}.
 *
 * @author hal.hildebrand
 */
public record DocumentStructure(ElementNode root, ElementNode options, Optional<ElementNode> defaults,
                                ElementNode worldbody) {

    private static final Map<Tag, Set<Tag>> ALLOWED_CHILDREN = new EnumMap<>(Tag.class);

    static {
        ALLOWED_CHILDREN.put(Tag.ROOT, EnumSet.of(Tag.OPTIONS, Tag.DEFAULTS, Tag.WORLDBODY));
        ALLOWED_CHILDREN.put(Tag.OPTIONS, EnumSet.noneOf(Tag.class));
        ALLOWED_CHILDREN.put(Tag.DEFAULTS, EnumSet.of(Tag.GEOM, Tag.BODY));
        ALLOWED_CHILDREN.put(Tag.WORLDBODY, EnumSet.of(Tag.BODY));
        ALLOWED_CHILDREN.put(Tag.BODY, EnumSet.of(Tag.BODY, Tag.GEOM));
        ALLOWED_CHILDREN.put(Tag.GEOM, EnumSet.noneOf(Tag.class));
    }

    /**
     * @param root    the document root
     * @param rootTag the configured name of the root element
     */
    public static DocumentStructure of(ElementNode root, String rootTag) {
        if (!root.name().equals(rootTag)) {
            throw new StructuralViolation(root.path(),
                                          "document root must be <" + rootTag + ">, found <" + root.name() + ">");
        }
        for (var node : root.preOrder()) {
            var tag = tagOf(node, rootTag);
            var inDefaults = node.parent().map(p -> p.name().equals(Tag.DEFAULTS.key())).orElse(false);
            // default sets are flat
            var allowed = inDefaults ? EnumSet.noneOf(Tag.class) : ALLOWED_CHILDREN.get(tag);
            for (var child : node.children()) {
                if (!allowed.contains(tagOf(child, rootTag))) {
                    throw new StructuralViolation(child.path(),
                                                  "<" + child.name() + "> is not allowed inside <" + node.name()
                                                  + ">");
                }
            }
        }
        var options = unique(root, Tag.OPTIONS.key()).orElseThrow(
        () -> new StructuralViolation(root.path(), "exactly one <options> is required, found none"));
        var worldbody = unique(root, Tag.WORLDBODY.key()).orElseThrow(
        () -> new StructuralViolation(root.path(), "exactly one <worldbody> is required, found none"));
        var defaults = unique(root, Tag.DEFAULTS.key());
        defaults.ifPresent(d -> {
            unique(d, Tag.GEOM.key());
            unique(d, Tag.BODY.key());
        });
        return new DocumentStructure(root, options, defaults, worldbody);
    }

    /**
     * @return the single child with the given name, or empty if there is none
     * @throws StructuralViolation if there is more than one
     */
    public static Optional<ElementNode> unique(ElementNode parent, String childName) {
        var found = parent.children(childName);
        if (found.size() > 1) {
            throw new StructuralViolation(parent.path(),
                                          "at most one <" + childName + "> is allowed, found " + found.size());
        }
        return found.stream().findFirst();
    }

    private static Tag tagOf(ElementNode node, String rootTag) {
        return Tag.resolve(node.name(), rootTag).orElseThrow(
        () -> new IllegalStateException("Unvalidated element reached structure check: " + node.path()));
    }
}
