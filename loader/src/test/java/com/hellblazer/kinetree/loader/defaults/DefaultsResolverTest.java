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
package com.hellblazer.kinetree.loader.defaults;

import com.hellblazer.kinetree.loader.attribute.AttributeValue;
import com.hellblazer.kinetree.loader.attribute.NumericCoercion;
import com.hellblazer.kinetree.loader.document.DocumentReader;
import com.hellblazer.kinetree.loader.document.DocumentStructure;
import com.hellblazer.kinetree.loader.document.ElementNode;
import com.hellblazer.kinetree.loader.schema.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class DefaultsResolverTest {

    private static DocumentStructure coerced(String xml) {
        var root = DocumentReader.read(xml, "test");
        var structure = DocumentStructure.of(root, "x_xy");
        NumericCoercion.coerce(root);
        return structure;
    }

    @Test
    public void fillsOnlyAbsent() {
        var structure = coerced("""
                                <x_xy>
                                    <options/>
                                    <defaults>
                                        <body damping="0.1" armature="0.2"/>
                                        <geom mass="3" vispy_color="self"/>
                                    </defaults>
                                    <worldbody>
                                        <body name="a" damping="0.5">
                                            <geom mass="1"/>
                                            <body name="b"/>
                                        </body>
                                    </worldbody>
                                </x_xy>
                                """);
        var table = DefaultsTable.from(structure.defaults());
        assertEquals(4, DefaultsResolver.apply(structure.worldbody(), table));

        var a = structure.worldbody().children("body").get(0);
        var b = a.children("body").get(0);
        var geom = a.children("geom").get(0);
        assertEquals("0.5", a.attributes().get("damping").raw());
        assertEquals("0.2", a.attributes().get("armature").raw());
        assertArrayEquals(new double[] { 0.1 }, b.attributes().get("damping").numbers().orElseThrow());
        assertEquals("1", geom.attributes().get("mass").raw());
        assertEquals(new AttributeValue.Text("self"), geom.attributes().get("vispy_color"));
        assertFalse(structure.worldbody().attributes().containsKey("damping"));

        assertEquals(0, DefaultsResolver.apply(structure.worldbody(), table));
    }

    @Test
    public void tagsDoNotMix() {
        var structure = coerced("""
                                <x_xy><options/>
                                    <defaults><geom pos="1 1 1"/></defaults>
                                    <worldbody><body name="a"/></worldbody>
                                </x_xy>
                                """);
        DefaultsResolver.apply(structure.worldbody(), DefaultsTable.from(structure.defaults()));
        assertFalse(structure.worldbody().children("body").get(0).attributes().containsKey("pos"));
    }

    @Test
    public void noDefaults() {
        var worldbody = new ElementNode("worldbody");
        worldbody.addChild("body").put("name", AttributeValue.text("a"));
        assertEquals(0, DefaultsResolver.apply(worldbody, DefaultsTable.from(Optional.empty())));
        assertEquals(1, worldbody.children("body").get(0).attributes().size());
    }

    @Test
    public void table() {
        assertTrue(DefaultsTable.empty().isEmpty());
        var damping = new AttributeValue.Numeric("1", new double[] { 1 });
        var table = new DefaultsTable(Map.of(), Map.of("damping", damping));
        assertFalse(table.isEmpty());
        assertEquals(Map.of("damping", damping), table.forTag(Tag.BODY));
        assertTrue(table.forTag(Tag.GEOM).isEmpty());
        assertTrue(table.forTag(Tag.OPTIONS).isEmpty());
    }
}
