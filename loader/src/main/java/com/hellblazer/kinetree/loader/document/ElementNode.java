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

import com.hellblazer.kinetree.loader.KinematicTreeException.MalformedAttribute;
import com.hellblazer.kinetree.loader.attribute.AttributeValue;
import com.hellblazer.kinetree.loader.schema.Attribute;

import java.util.*;

/**
 * Mutable element of the document tree. Attribute values are rewritten in place by numeric coercion and the
 * defaults merge; nothing else changes the tree once it is read.
 *
 * @author hal.hildebrand
 */
public final class ElementNode {

    private final String                      name;
    private final ElementNode                 parent;
    private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
    private final List<ElementNode>           children   = new ArrayList<>();

    public ElementNode(String name) {
        this(name, null);
    }

    private ElementNode(String name, ElementNode parent) {
        this.name = Objects.requireNonNull(name, "name");
        this.parent = parent;
    }

    public ElementNode addChild(String childName) {
        var child = new ElementNode(childName, this);
        children.add(child);
        return child;
    }

    public Optional<AttributeValue> attribute(Attribute attribute) {
        return Optional.ofNullable(attributes.get(attribute.key()));
    }

    public Map<String, AttributeValue> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * @return the direct children with the given element name, in document order
     */
    public List<ElementNode> children(String childName) {
        return children.stream().filter(c -> c.name.equals(childName)).toList();
    }

    public List<ElementNode> children() {
        return Collections.unmodifiableList(children);
    }

    public String name() {
        return name;
    }

    public Optional<ElementNode> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Slash separated location of the receiver, used in error messages. Bodies are identified by their name when they
     * have one, everything else by its position among same named siblings.
     */
    public String path() {
        var labels = new ArrayDeque<String>();
        for (var node = this; node != null; node = node.parent) {
            labels.push(node.label());
        }
        return String.join("/", labels);
    }

    /**
     * @return the receiver and all its descendants, depth first, in document order
     */
    public List<ElementNode> preOrder() {
        var result = new ArrayList<ElementNode>();
        var stack = new ArrayDeque<ElementNode>();
        stack.push(this);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            result.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return result;
    }

    public void put(String key, AttributeValue value) {
        attributes.put(key, Objects.requireNonNull(value, "value"));
    }

    public void putIfAbsent(String key, AttributeValue value) {
        attributes.putIfAbsent(key, Objects.requireNonNull(value, "value"));
    }

    public double requireScalar(Attribute attribute) {
        var values = requireVector(attribute);
        if (values.length != 1) {
            throw new MalformedAttribute(path(), attribute.key(), "must be a single number, got " + values.length);
        }
        return values[0];
    }

    public String requireText(Attribute attribute) {
        return attribute(attribute).map(AttributeValue::raw)
                                   .orElseThrow(() -> new MalformedAttribute(path(), attribute.key(), "is required"));
    }

    public double[] requireVector(Attribute attribute) {
        return vector(attribute).orElseThrow(() -> new MalformedAttribute(path(), attribute.key(), "is required"));
    }

    public double[] requireVector(Attribute attribute, int length) {
        var values = requireVector(attribute);
        checkLength(attribute, values, length);
        return values;
    }

    @Override
    public String toString() {
        return "<" + name + " " + attributes + ">";
    }

    /**
     * @return the numbers of the attribute if present; a present but non numeric value is an error
     */
    public Optional<double[]> vector(Attribute attribute) {
        var value = attributes.get(attribute.key());
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(value.numbers()
                                .orElseThrow(() -> new MalformedAttribute(path(), attribute.key(),
                                                                          "must be numeric, got '" + value.raw()
                                                                          + "'")));
    }

    public Optional<double[]> vector(Attribute attribute, int length) {
        var values = vector(attribute);
        values.ifPresent(v -> checkLength(attribute, v, length));
        return values;
    }

    private String label() {
        var named = attributes.get(Attribute.NAME.key());
        if (named != null && name.equals("body")) {
            return name + "[" + named.raw() + "]";
        }
        if (parent == null) {
            return name;
        }
        var index = 0;
        for (var sibling : parent.children) {
            if (sibling == this) {
                break;
            }
            if (sibling.name.equals(name)) {
                index++;
            }
        }
        return name + "[" + index + "]";
    }

    private void checkLength(Attribute attribute, double[] values, int length) {
        if (values.length != length) {
            throw new MalformedAttribute(path(), attribute.key(),
                                         "requires " + length + " numbers, got " + values.length);
        }
    }
}
