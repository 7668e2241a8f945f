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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.kinetree.geometry.OrientationMath;
import com.hellblazer.kinetree.geometry.Orientations;
import com.hellblazer.kinetree.loader.schema.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Configuration of a {@link KinematicTreeLoader}.
 *
 * <p>Immutable; the {@code with} methods return modified copies. A configuration can also be read from a JSON
 * classpath resource, see {@link #load(String)}.
 *
 * @author hal.hildebrand
 */
public final class LoaderConfiguration {

    /** Classpath resource consulted by {@link #load()} */
    public static final String DEFAULT_RESOURCE = "/kinetree-loader.json";

    /** Name of the document root element */
    public static final String DEFAULT_ROOT_TAG = "x_xy";

    /** Prefix marking a geometry attribute as a rendering hint */
    public static final String DEFAULT_VISUAL_PREFIX = "vispy";

    public static final String DEFAULT_VISUAL_SEPARATOR = "_";

    private static final Logger       log          = LoggerFactory.getLogger(LoaderConfiguration.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String          rootTag;
    private final String          visualPrefix;
    private final String          visualSeparator;
    private final boolean         enforceUniqueNames;
    private final OrientationMath orientationMath;

    /**
     * @param rootTag            name of the document root element
     * @param visualPrefix       prefix marking rendering hints on geometries
     * @param visualSeparator    separator between the prefix and the hint name
     * @param enforceUniqueNames whether two bodies sharing a name is an error
     * @param orientationMath    euler angle conversion
     * @throws IllegalArgumentException if a name is blank or contains whitespace, or the root tag is reserved
     */
    public LoaderConfiguration(String rootTag, String visualPrefix, String visualSeparator,
                               boolean enforceUniqueNames, OrientationMath orientationMath) {
        Objects.requireNonNull(rootTag, "rootTag cannot be null");
        Objects.requireNonNull(visualPrefix, "visualPrefix cannot be null");
        Objects.requireNonNull(visualSeparator, "visualSeparator cannot be null");
        Objects.requireNonNull(orientationMath, "orientationMath cannot be null");
        if (rootTag.isBlank() || !rootTag.strip().equals(rootTag)) {
            throw new IllegalArgumentException("rootTag must be a non blank element name: '" + rootTag + "'");
        }
        if (Tag.isReserved(rootTag)) {
            throw new IllegalArgumentException("rootTag cannot be the reserved tag <" + rootTag + ">");
        }
        if (visualPrefix.isBlank() || visualPrefix.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("visualPrefix must be non blank: '" + visualPrefix + "'");
        }
        if (visualSeparator.isEmpty() || visualSeparator.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("visualSeparator must be non empty: '" + visualSeparator + "'");
        }
        this.rootTag = rootTag;
        this.visualPrefix = visualPrefix;
        this.visualSeparator = visualSeparator;
        this.enforceUniqueNames = enforceUniqueNames;
        this.orientationMath = orientationMath;
    }

    public static LoaderConfiguration defaultConfig() {
        return new LoaderConfiguration(DEFAULT_ROOT_TAG, DEFAULT_VISUAL_PREFIX, DEFAULT_VISUAL_SEPARATOR, true,
                                       Orientations.intrinsicXyz());
    }

    /**
     * @return the configuration from {@link #DEFAULT_RESOURCE}, or {@link #defaultConfig()} if there is none
     */
    public static LoaderConfiguration load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Read a configuration from a JSON classpath resource. Absent keys keep their defaults. A missing resource, or one
     * that is unreadable, malformed or holds an invalid value, yields {@link #defaultConfig()}.
     *
     * @param resource absolute classpath resource name
     */
    public static LoaderConfiguration load(String resource) {
        try (var is = LoaderConfiguration.class.getResourceAsStream(resource)) {
            if (is == null) {
                log.debug("Loader configuration not found: {}, using defaults", resource);
                return defaultConfig();
            }
            return parse(is);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load loader configuration {}: {}, using defaults", resource, e.getMessage());
            return defaultConfig();
        }
    }

    /**
     * Same as {@link #defaultConfig()}, except duplicate body names are accepted.
     */
    public static LoaderConfiguration permissiveConfig() {
        return defaultConfig().withEnforceUniqueNames(false);
    }

    private static LoaderConfiguration parse(InputStream is) throws IOException {
        JsonNode root = objectMapper.readTree(is);
        if (root == null || !root.isObject()) {
            throw new IOException("Expected a JSON object");
        }
        var defaults = defaultConfig();
        var config = new LoaderConfiguration(text(root, "rootTag", defaults.rootTag),
                                             text(root, "visualPrefix", defaults.visualPrefix),
                                             text(root, "visualSeparator", defaults.visualSeparator),
                                             flag(root, "enforceUniqueNames", defaults.enforceUniqueNames),
                                             defaults.orientationMath);
        log.debug("Loaded {}", config);
        return config;
    }

    private static boolean flag(JsonNode root, String field, boolean fallback) throws IOException {
        if (!root.has(field)) {
            return fallback;
        }
        var node = root.get(field);
        if (!node.isBoolean()) {
            throw new IOException("Expected a boolean for " + field + ", got " + node);
        }
        return node.booleanValue();
    }

    private static String text(JsonNode root, String field, String fallback) throws IOException {
        if (!root.has(field)) {
            return fallback;
        }
        var node = root.get(field);
        if (!node.isTextual()) {
            throw new IOException("Expected a string for " + field + ", got " + node);
        }
        return node.textValue();
    }

    public boolean enforceUniqueNames() {
        return enforceUniqueNames;
    }

    public OrientationMath orientationMath() {
        return orientationMath;
    }

    public String rootTag() {
        return rootTag;
    }

    public String visualPrefix() {
        return visualPrefix;
    }

    public String visualSeparator() {
        return visualSeparator;
    }

    public LoaderConfiguration withEnforceUniqueNames(boolean enforce) {
        return new LoaderConfiguration(rootTag, visualPrefix, visualSeparator, enforce, orientationMath);
    }

    public LoaderConfiguration withOrientationMath(OrientationMath math) {
        return new LoaderConfiguration(rootTag, visualPrefix, visualSeparator, enforceUniqueNames, math);
    }

    public LoaderConfiguration withRootTag(String tag) {
        return new LoaderConfiguration(tag, visualPrefix, visualSeparator, enforceUniqueNames, orientationMath);
    }

    public LoaderConfiguration withVisualPrefix(String prefix, String separator) {
        return new LoaderConfiguration(rootTag, prefix, separator, enforceUniqueNames, orientationMath);
    }

    @Override
    public String toString() {
        return "LoaderConfiguration{rootTag=" + rootTag + ", visual=" + visualPrefix + visualSeparator
        + ", enforceUniqueNames=" + enforceUniqueNames + "}";
    }
}
