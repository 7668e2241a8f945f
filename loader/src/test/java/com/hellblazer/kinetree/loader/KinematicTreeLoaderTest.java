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

import com.hellblazer.kinetree.loader.KinematicTreeException.ConflictingOrientation;
import com.hellblazer.kinetree.loader.KinematicTreeException.DuplicateLinkName;
import com.hellblazer.kinetree.loader.KinematicTreeException.MalformedAttribute;
import com.hellblazer.kinetree.loader.KinematicTreeException.MalformedDocument;
import com.hellblazer.kinetree.loader.KinematicTreeException.SchemaViolation;
import com.hellblazer.kinetree.loader.KinematicTreeException.StructuralViolation;
import com.hellblazer.kinetree.loader.KinematicTreeException.UnknownGeomShape;
import com.hellblazer.kinetree.loader.KinematicTreeException.UnknownJointType;
import com.hellblazer.kinetree.loader.attribute.AttributeValue;
import com.hellblazer.kinetree.loader.model.Geometry;
import com.hellblazer.kinetree.loader.model.JointType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.vecmath.Vector3d;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.hellblazer.kinetree.loader.Documents.document;
import static com.hellblazer.kinetree.loader.Documents.world;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class KinematicTreeLoaderTest {

    private static final double EPSILON = 1e-9;

    private final KinematicTreeLoader loader = new KinematicTreeLoader();

    @Test
    public void parentBeforeChild() {
        var tree = loader.load(world("""
                                     <body name="a" joint="free" pos="0 0 1">
                                         <body name="b" joint="hinge">
                                             <geom type="sphere" mass="1.0" pos="0 0 0" dim="0.1"/>
                                         </body>
                                     </body>
                                     """));
        assertEquals(2, tree.size());
        assertArrayEquals(new int[] { -1, 0 }, tree.parents());
        assertEquals(List.of("a", "b"), tree.names());
        assertEquals(List.of(JointType.FREE, JointType.HINGE), tree.jointTypes());
        assertEquals(new Vector3d(0, 0, 1), tree.transform(0).position());
        assertTrue(tree.geoms(0).isEmpty());
        assertEquals(1, tree.geoms(1).size());
        var sphere = assertInstanceOf(Geometry.Sphere.class, tree.geoms(1).get(0));
        assertEquals(0.1, sphere.radius());
        assertEquals(1.0, sphere.mass());
        assertEquals(new Vector3d(), sphere.localPosition());
        assertEquals(7, tree.qdSize());
        assertEquals(7, tree.dampings().length);
        assertEquals(7, tree.armatures().length);
        assertEquals(Optional.of("test"), tree.model());
    }

    @Test
    public void preOrderIdsAcrossSiblingsAndRoots() {
        var tree = loader.load(world("""
                                     <body name="r0" joint="frozen">
                                         <body name="c0" joint="rx">
                                             <body name="g0" joint="ry"/>
                                         </body>
                                         <body name="c1" joint="rz"/>
                                     </body>
                                     <body name="r1" joint="spherical">
                                         <body name="c2" joint="px"/>
                                     </body>
                                     """));
        assertEquals(List.of("r0", "c0", "g0", "c1", "r1", "c2"), tree.names());
        assertArrayEquals(new int[] { -1, 0, 1, 0, -1, 4 }, tree.parents());
        assertArrayEquals(new int[] { 0, 4 }, tree.roots());
        assertArrayEquals(new int[] { 1, 3 }, tree.children(0));
        assertEquals(0 + 1 + 1 + 1 + 3 + 1, tree.qdSize());
        assertEquals(4, tree.qdOffset(4));
    }

    @Test
    public void bodyDefaultsFillByDegreesOfFreedom() {
        var tree = loader.load(document("<body damping=\"0.1\"/>", """
                                        <body name="free" joint="free">
                                            <body name="hinge" joint="hinge" damping="0.5"/>
                                            <body name="frozen" joint="frozen"/>
                                        </body>
                                        """));
        assertArrayEquals(new double[] { 0.1, 0.1, 0.1, 0.1, 0.1, 0.1 }, tree.damping(0));
        assertArrayEquals(new double[] { 0.5 }, tree.damping(1));
        assertArrayEquals(new double[0], tree.damping(2));
        assertArrayEquals(new double[] { 0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.5 }, tree.dampings());
        assertArrayEquals(new double[7], tree.armatures());
    }

    @Test
    public void geomDefaults() {
        var tree = loader.load(document("<geom type=\"box\" mass=\"2\" dim=\"1 2 3\"/>", """
                                        <body name="a" joint="rx">
                                            <geom pos="0 0 0"/>
                                            <geom type="sphere" pos="1 0 0" dim="0.5"/>
                                        </body>
                                        """));
        var box = assertInstanceOf(Geometry.Box.class, tree.geoms(0).get(0));
        assertArrayEquals(new double[] { 1, 2, 3 }, box.dimensions());
        assertEquals(2.0, box.mass());
        var sphere = assertInstanceOf(Geometry.Sphere.class, tree.geoms(0).get(1));
        assertEquals(0.5, sphere.radius());
        assertEquals(2.0, sphere.mass());
    }

    @Test
    public void explicitOnlyDocumentIgnoresEmptyDefaults() {
        var bodies = """
                     <body name="a" joint="free" pos="1 2 3" damping="1 2 3 4 5 6" armature="0">
                         <geom type="cylinder" mass="3" pos="0 0 1" dim="0.2 1.5" vispy_color="blue"/>
                         <body name="b" joint="cor" quat="0 0 1 0"/>
                     </body>
                     """;
        var without = loader.load(world(bodies));
        var withEmpty = loader.load(document("", bodies));
        var withEmptyEntries = loader.load(document("<geom/><body/>", bodies));
        assertEquals(without, withEmpty);
        assertEquals(without, withEmptyEntries);
    }

    @Test
    public void visualMetadata() {
        var tree = loader.load(world("""
                                     <body name="a" joint="rx">
                                         <geom type="sphere" mass="1" pos="0 0 0" dim="1" vispy_color="1 0 0" vispy_edge_color="black"/>
                                     </body>
                                     """));
        var metadata = tree.geoms(0).get(0).visualMetadata();
        assertEquals(2, metadata.size());
        var color = assertInstanceOf(AttributeValue.Numeric.class, metadata.get("color"));
        assertArrayEquals(new double[] { 1, 0, 0 }, color.values());
        assertEquals(new AttributeValue.Text("black"), metadata.get("edge_color"));
    }

    @Test
    public void identityOrientation() {
        var tree = loader.load(world("<body name=\"a\" joint=\"rx\"/>"));
        assertArrayEquals(new double[] { 1, 0, 0, 0 }, tree.transform(0).wxyz());
    }

    @Test
    public void eulerInDegrees() {
        var tree = loader.load(world("<body name=\"a\" joint=\"rx\" euler=\"0 0 90\"/>"));
        var half = Math.sqrt(0.5);
        assertArrayEquals(new double[] { half, 0, 0, half }, tree.transform(0).wxyz(), EPSILON);
    }

    @Test
    public void conflictingOrientation() {
        var e = assertThrows(ConflictingOrientation.class, () -> loader.load(
        world("<body name=\"a\" joint=\"rx\" quat=\"1 0 0 0\" euler=\"0 0 0\"/>")));
        assertEquals("x_xy/worldbody[0]/body[a]", e.getPath());
    }

    @Test
    public void conflictingOrientationThroughDefaults() {
        assertThrows(ConflictingOrientation.class, () -> loader.load(
        document("<body euler=\"0 0 0\"/>", "<body name=\"a\" joint=\"rx\" quat=\"1 0 0 0\"/>")));
    }

    @Test
    public void unknownTag() {
        var e = assertThrows(SchemaViolation.class, () -> loader.loadResource("/models/motor.xml"));
        assertEquals("motor", e.getTag());
        assertNull(e.getAttribute());
        assertEquals("x_xy/worldbody[0]/body[a]/motor[0]", e.getPath());
    }

    @Test
    public void schemaCheckPrecedesInterpretation() {
        var e = assertThrows(SchemaViolation.class,
                             () -> loader.load(world("<body name=\"a\" joint=\"bogus\" color=\"red\"/>")));
        assertEquals("color", e.getAttribute());
        assertEquals("body", e.getTag());
    }

    @Test
    public void unknownJointType() {
        var e = assertThrows(UnknownJointType.class, () -> loader.load(world("<body name=\"a\" joint=\"ball\"/>")));
        assertEquals("ball", e.getJointType());
    }

    @Test
    public void failureDeepInTheHierarchy() {
        var depth = 20_000;
        var bodies = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            bodies.append("<body name=\"l").append(i).append("\" joint=\"rx\">");
        }
        bodies.append("<body name=\"leaf\" joint=\"ball\"/>");
        bodies.append("</body>".repeat(depth));

        var e = assertThrows(UnknownJointType.class, () -> loader.load(world(bodies.toString())));
        assertEquals("ball", e.getJointType());
        assertTrue(e.getPath().startsWith("x_xy/worldbody[0]/body[l0]/body[l1]/"));
        assertTrue(e.getPath().endsWith("/body[l" + (depth - 1) + "]/body[leaf]"));
    }

    @Test
    public void unknownGeomShape() {
        var e = assertThrows(UnknownGeomShape.class, () -> loader.load(world("""
                                                                           <body name="a" joint="rx">
                                                                               <geom type="capsule" mass="1" pos="0 0 0" dim="1 2"/>
                                                                           </body>
                                                                           """)));
        assertEquals("capsule", e.getShape());
        assertEquals("x_xy/worldbody[0]/body[a]/geom[0]", e.getPath());
    }

    @Test
    public void wrongDimensionArity() {
        var e = assertThrows(MalformedAttribute.class, () -> loader.load(world("""
                                                                             <body name="a" joint="rx">
                                                                                 <geom type="box" mass="1" pos="0 0 0" dim="1 2"/>
                                                                             </body>
                                                                             """)));
        assertEquals("dim", e.getAttribute());
    }

    @Test
    public void dampingWidthMustMatchJoint() {
        var e = assertThrows(MalformedAttribute.class,
                             () -> loader.load(world("<body name=\"a\" joint=\"spherical\" damping=\"1 2\"/>")));
        assertEquals("damping", e.getAttribute());
    }

    @Test
    public void missingRequiredAttributes() {
        assertEquals("name", assertThrows(MalformedAttribute.class,
                                          () -> loader.load(world("<body joint=\"rx\"/>"))).getAttribute());
        assertEquals("joint", assertThrows(MalformedAttribute.class,
                                           () -> loader.load(world("<body name=\"a\"/>"))).getAttribute());
        assertEquals("mass", assertThrows(MalformedAttribute.class, () -> loader.load(world("""
                                                                                            <body name="a" joint="rx">
                                                                                                <geom type="sphere" pos="0 0 0" dim="1"/>
                                                                                            </body>
                                                                                            """))).getAttribute());
    }

    @Test
    public void textWhereNumbersAreRequired() {
        var e = assertThrows(MalformedAttribute.class,
                             () -> loader.load(world("<body name=\"a\" joint=\"rx\" pos=\"up\"/>")));
        assertEquals("pos", e.getAttribute());
    }

    @Test
    public void duplicateNames() {
        var bodies = "<body name=\"a\" joint=\"rx\"><body name=\"a\" joint=\"ry\"/></body>";
        var e = assertThrows(DuplicateLinkName.class, () -> loader.load(world(bodies)));
        assertEquals("a", e.getName());

        var tree = new KinematicTreeLoader(LoaderConfiguration.permissiveConfig()).load(world(bodies));
        assertEquals(List.of("a", "a"), tree.names());
        assertEquals(0, tree.indexOf("a").getAsInt());
    }

    @Test
    public void numericLookingNamesStayAsWritten() {
        var tree = loader.load(world("<body name=\"1e3\" joint=\"rx\"/>"));
        assertEquals("1e3", tree.name(0));
    }

    @Test
    public void missingSections() {
        assertThrows(StructuralViolation.class,
                     () -> loader.load("<x_xy><worldbody><body name=\"a\" joint=\"rx\"/></worldbody></x_xy>"));
        assertThrows(StructuralViolation.class, () -> loader.load("<x_xy>" + Documents.OPTIONS + "</x_xy>"));
        assertThrows(StructuralViolation.class, () -> loader.load(
        "<x_xy>" + Documents.OPTIONS + Documents.OPTIONS + "<worldbody/></x_xy>"));
        assertThrows(StructuralViolation.class,
                     () -> loader.load(document("<body damping=\"1\"/><body damping=\"2\"/>", "")));
    }

    @Test
    public void optionsRequired() {
        assertEquals("dt", assertThrows(MalformedAttribute.class, () -> loader.load(
        "<x_xy><options gravity=\"0 0 -9.81\"/><worldbody/></x_xy>")).getAttribute());
        assertEquals("dt", assertThrows(MalformedAttribute.class, () -> loader.load(
        "<x_xy><options gravity=\"0 0 -9.81\" dt=\"0\"/><worldbody/></x_xy>")).getAttribute());
        assertEquals("gravity", assertThrows(MalformedAttribute.class, () -> loader.load(
        "<x_xy><options gravity=\"0 -9.81\" dt=\"0.1\"/><worldbody/></x_xy>")).getAttribute());
    }

    @Test
    public void emptyWorld() {
        var tree = loader.load(world(""));
        assertEquals(0, tree.size());
        assertEquals(0, tree.qdSize());
        assertEquals(new Vector3d(0, 0, -9.81), tree.options().gravity());
        assertEquals(0.01, tree.options().dt());
    }

    @Test
    public void malformedText() {
        assertThrows(MalformedDocument.class, () -> loader.load("<x_xy><options"));
        assertThrows(MalformedDocument.class, () -> loader.loadResource("/models/does-not-exist.xml"));
        assertThrows(MalformedDocument.class, () -> loader.load(
        "<!DOCTYPE x_xy [<!ENTITY e SYSTEM \"file:///etc/passwd\">]><x_xy>&e;</x_xy>"));
    }

    @Test
    public void resource() {
        var tree = loader.loadResource("/models/double_pendulum.xml");
        assertEquals(Optional.of("double_pendulum"), tree.model());
        assertEquals(List.of("anchor", "upper", "lower", "floating"), tree.names());
        assertArrayEquals(new int[] { -1, 0, 1, -1 }, tree.parents());
        assertEquals(8, tree.qdSize());
        assertEquals(9, tree.qSize());
        assertArrayEquals(new double[] { 0.1, 0.5, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1 }, tree.dampings());
        assertArrayEquals(new double[] { 0.02, 0, 0, 0, 0, 0, 0, 0 }, tree.armatures());

        var half = Math.sqrt(0.5);
        assertArrayEquals(new double[] { half, 0, half, 0 }, tree.transform(1).wxyz(), EPSILON);
        assertArrayEquals(new double[] { 0, 1, 0, 0 }, tree.transform(3).wxyz());
        assertEquals(new Vector3d(0, 0, 2), tree.transform(0).position());

        var box = tree.geoms(1).get(0);
        assertArrayEquals(new double[] { 0.8, 0.2, 0.2 },
                          assertInstanceOf(AttributeValue.Numeric.class, box.visualMetadata().get("color")).values());
        assertEquals(Map.of("color", new AttributeValue.Text("self")), tree.geoms(2).get(0).visualMetadata());
        assertEquals(2, tree.geoms(2).size());
        assertInstanceOf(Geometry.Cylinder.class, tree.geoms(2).get(0));
        assertEquals(0.25, assertInstanceOf(Geometry.Sphere.class, tree.geoms(3).get(0)).radius());
    }

    @Test
    public void file(@TempDir Path dir) throws IOException {
        var file = dir.resolve("model.xml");
        Files.writeString(file, world("<body name=\"a\" joint=\"px\"/>"));
        assertEquals(List.of("a"), loader.load(file).names());
        assertThrows(MalformedDocument.class, () -> loader.load(dir.resolve("missing.xml")));
    }

    @Test
    public void customRootTag() {
        var robot = new KinematicTreeLoader(LoaderConfiguration.defaultConfig().withRootTag("robot"));
        var xml = "<robot>" + Documents.OPTIONS + "<worldbody><body name=\"a\" joint=\"rx\"/></worldbody></robot>";
        assertEquals(1, robot.load(xml).size());
        assertThrows(SchemaViolation.class, () -> loader.load(xml));
    }

    @Test
    public void loadsAreIndependent() {
        var first = loader.load(world("<body name=\"a\" joint=\"rx\"/>"));
        var second = loader.load(world("<body name=\"a\" joint=\"rx\"/>"));
        assertEquals(first, second);
        assertArrayEquals(new int[] { -1 }, second.parents());
    }
}
