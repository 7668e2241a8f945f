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

import com.hellblazer.kinetree.loader.KinematicTreeException.MalformedDocument;
import com.hellblazer.kinetree.loader.attribute.AttributeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;

/**
 * Reads XML text into an {@link ElementNode} tree. Every attribute starts out as {@link AttributeValue.Text}; text
 * content, comments and processing instructions are dropped. DTDs and external entities are refused.
 *
 * @author hal.hildebrand
 */
public final class DocumentReader {

    private static final Logger log = LoggerFactory.getLogger(DocumentReader.class);

    private static final ErrorHandler STRICT = new ErrorHandler() {
        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void warning(SAXParseException exception) {
            log.warn("XML warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }
    };

    private DocumentReader() {
    }

    /**
     * @param xml    the document text
     * @param source description of where the text came from, for error messages
     * @return the root element
     */
    public static ElementNode read(String xml, String source) {
        Element root;
        try {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(false);
            var builder = factory.newDocumentBuilder();
            builder.setErrorHandler(STRICT);
            var doc = builder.parse(new InputSource(new StringReader(xml)));
            root = doc.getDocumentElement();
        } catch (SAXParseException e) {
            throw new MalformedDocument(source, "not well formed at line " + e.getLineNumber() + ", column "
                                                + e.getColumnNumber() + ": " + e.getMessage(), e);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new MalformedDocument(source, "cannot parse: " + e.getMessage(), e);
        }
        var result = convert(root);
        log.trace("Read document <{}> from {}", result.name(), source);
        return result;
    }

    private static void copyAttributes(Element from, ElementNode to) {
        var attrs = from.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            var attr = attrs.item(i);
            to.put(attr.getNodeName(), AttributeValue.text(attr.getNodeValue()));
        }
    }

    // Iterative, so deeply nested bodies cannot exhaust the call stack
    private static ElementNode convert(Element root) {
        record Pending(Element element, ElementNode node) {
        }
        var result = new ElementNode(root.getTagName());
        var stack = new ArrayDeque<Pending>();
        stack.push(new Pending(root, result));
        while (!stack.isEmpty()) {
            var pending = stack.pop();
            copyAttributes(pending.element(), pending.node());
            var children = pending.element().getChildNodes();
            for (int i = 0; i < children.getLength(); i++) {
                var child = children.item(i);
                if (child.getNodeType() == Node.ELEMENT_NODE) {
                    var element = (Element) child;
                    // attached in document order; the order they are visited in does not matter
                    stack.push(new Pending(element, pending.node().addChild(element.getTagName())));
                }
            }
        }
        return result;
    }
}
