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

import com.hellblazer.kinetree.loader.KinematicTreeException.MalformedAttribute;
import com.hellblazer.kinetree.loader.KinematicTreeException.MalformedDocument;
import com.hellblazer.kinetree.loader.attribute.AttributeValue;
import com.hellblazer.kinetree.loader.attribute.NumericCoercion;
import com.hellblazer.kinetree.loader.attribute.VisualMetadataExtractor;
import com.hellblazer.kinetree.loader.defaults.DefaultsResolver;
import com.hellblazer.kinetree.loader.defaults.DefaultsTable;
import com.hellblazer.kinetree.loader.document.DocumentReader;
import com.hellblazer.kinetree.loader.document.DocumentStructure;
import com.hellblazer.kinetree.loader.document.ElementNode;
import com.hellblazer.kinetree.loader.model.KinematicTree;
import com.hellblazer.kinetree.loader.model.Options;
import com.hellblazer.kinetree.loader.schema.Attribute;
import com.hellblazer.kinetree.loader.schema.AttributeSchema;
import com.hellblazer.kinetree.loader.tree.TreeFlattener;
import com.hellblazer.kinetree.loader.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3d;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads a {@link KinematicTree} from its XML description.
 * <p>
 * The pipeline, in order: read the document, check it against the attribute schema, locate its sections, coerce
 * numeric attributes, merge the declared defaults, walk the body hierarchy, flatten the walked links, and finally
 * hand the tree to the {@link TreePostProcessor}. Any violation aborts the load with a {@link KinematicTreeException}.
 * <p>
 * The loader keeps no state between loads, so one instance may serve any number of threads.
 *
 * @author hal.hildebrand
 */
public class KinematicTreeLoader {

    private static final Logger log = LoggerFactory.getLogger(KinematicTreeLoader.class);

    private final LoaderConfiguration config;
    private final TreePostProcessor   postProcessor;
    private final AttributeSchema     schema;
    private final TreeWalker          walker;

    public KinematicTreeLoader() {
        this(LoaderConfiguration.defaultConfig());
    }

    public KinematicTreeLoader(LoaderConfiguration config) {
        this(config, TreePostProcessor.identity());
    }

    public KinematicTreeLoader(LoaderConfiguration config, TreePostProcessor postProcessor) {
        this.config = Objects.requireNonNull(config, "config");
        this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor");
        var visual = new VisualMetadataExtractor(config.visualPrefix(), config.visualSeparator());
        this.schema = new AttributeSchema(config.rootTag(), visual);
        this.walker = new TreeWalker(config.orientationMath(), visual, config.enforceUniqueNames());
    }

    /**
     * Load from a file, read as UTF-8
     */
    public KinematicTree load(Path file) {
        String xml;
        try {
            xml = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedDocument(file.toString(), "cannot read: " + e.getMessage(), e);
        }
        return load(xml, file.toString());
    }

    /**
     * Load from XML text
     */
    public KinematicTree load(String xml) {
        return load(xml, "<string>");
    }

    /**
     * Load from a classpath resource, read as UTF-8
     *
     * @param resource absolute classpath resource name
     */
    public KinematicTree loadResource(String resource) {
        String xml;
        try (var is = KinematicTreeLoader.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new MalformedDocument(resource, "resource not found", null);
            }
            xml = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedDocument(resource, "cannot read: " + e.getMessage(), e);
        }
        return load(xml, resource);
    }

    private KinematicTree load(String xml, String source) {
        var startTime = System.nanoTime();
        var root = DocumentReader.read(xml, source);

        schema.validate(root);
        var structure = DocumentStructure.of(root, config.rootTag());

        NumericCoercion.coerce(root);
        var defaults = DefaultsTable.from(structure.defaults());
        DefaultsResolver.apply(structure.worldbody(), defaults);

        var options = options(structure.options());
        var links = walker.walk(structure.worldbody());
        var model = root.attribute(Attribute.MODEL).map(AttributeValue::raw);
        var tree = TreeFlattener.flatten(links, options, model);

        log.debug("Loaded {} from {} in {} ms", tree, source, (System.nanoTime() - startTime) / 1_000_000);
        return postProcessor.process(tree);
    }

    private Options options(ElementNode options) {
        var gravity = options.requireVector(Attribute.GRAVITY, 3);
        var dt = options.requireScalar(Attribute.DT);
        if (!(dt > 0)) {
            throw new MalformedAttribute(options.path(), Attribute.DT.key(), "must be positive, got " + dt);
        }
        return new Options(new Vector3d(gravity), dt);
    }
}
