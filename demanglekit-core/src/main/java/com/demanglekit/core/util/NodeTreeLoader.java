package com.demanglekit.core.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads node trees captured as JSON or YAML.
 *
 * <p>Every node is an object with a {@code kind} (the CamelCase tag name) and optional
 * {@code text}, {@code index} and {@code children} fields. Indices are unsigned 64-bit and
 * may be written as numbers or as decimal strings.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * kind: Type
 * children:
 *   - kind: Structure
 *     children:
 *       - { kind: Module, text: Swift }
 *       - { kind: Identifier, text: Int }
 * }</pre>
 */
public final class NodeTreeLoader {

    private static final Logger log = LoggerFactory.getLogger(NodeTreeLoader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final String FIELD_KIND = "kind";
    private static final String FIELD_TEXT = "text";
    private static final String FIELD_INDEX = "index";
    private static final String FIELD_CHILDREN = "children";

    private NodeTreeLoader() {
        // Prevent instantiation
    }

    /**
     * Loads a tree from a file; {@code .json} files are read as JSON, anything else as YAML.
     *
     * @param path file to read
     * @return root node
     * @throws UncheckedIOException if the file cannot be read or parsed
     * @throws IllegalArgumentException if the content is not a valid node tree
     */
    public static Node load(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = fileName.endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
        try {
            log.debug("Loading node tree from: {}", path);
            return fromTree(mapper.readTree(Files.readString(path)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read node tree: " + path, e);
        }
    }

    public static Node fromJson(String json) {
        return parse(JSON_MAPPER, json);
    }

    public static Node fromYaml(String yaml) {
        return parse(YAML_MAPPER, yaml);
    }

    private static Node parse(ObjectMapper mapper, String content) {
        try {
            return fromTree(mapper.readTree(content));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse node tree", e);
        }
    }

    /**
     * Converts an already parsed document into a node tree.
     *
     * @param tree parsed JSON or YAML document
     * @return root node
     * @throws IllegalArgumentException if the document is not a valid node tree
     */
    public static Node fromTree(JsonNode tree) {
        if (tree == null || !tree.isObject()) {
            throw new IllegalArgumentException("Node must be an object, got: " + describe(tree));
        }

        JsonNode kindField = tree.get(FIELD_KIND);
        if (kindField == null || !kindField.isTextual()) {
            throw new IllegalArgumentException("Node without kind: " + tree);
        }
        NodeKind kind = NodeKind.fromKindName(kindField.asText())
            .orElseThrow(() -> new IllegalArgumentException("Unknown node kind: " + kindField.asText()));

        JsonNode textField = tree.get(FIELD_TEXT);
        String text = textField == null || textField.isNull() ? null : textField.asText();

        Long index = readIndex(tree.get(FIELD_INDEX));

        List<Node> children = new ArrayList<>();
        JsonNode childrenField = tree.get(FIELD_CHILDREN);
        if (childrenField != null && !childrenField.isNull()) {
            if (!childrenField.isArray()) {
                throw new IllegalArgumentException("children of " + kind.kindName() + " must be a list");
            }
            for (JsonNode child : childrenField) {
                children.add(fromTree(child));
            }
        }
        return new Node(kind, text, index, children);
    }

    private static Long readIndex(JsonNode indexField) {
        if (indexField == null || indexField.isNull()) {
            return null;
        }
        if (indexField.isIntegralNumber()) {
            BigInteger value = indexField.bigIntegerValue();
            if (value.signum() < 0 || value.bitLength() > Long.SIZE) {
                throw new IllegalArgumentException("Index out of unsigned 64-bit range: " + value);
            }
            // values above Long.MAX_VALUE keep their unsigned bit pattern
            return value.longValue();
        }
        if (indexField.isTextual()) {
            try {
                return Long.parseUnsignedLong(indexField.asText());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid index: " + indexField.asText(), e);
            }
        }
        throw new IllegalArgumentException("Invalid index: " + indexField);
    }

    private static String describe(JsonNode tree) {
        return tree == null ? "nothing" : tree.getNodeType().toString();
    }
}
