package com.flowexpr.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.flowexpr.ast.*;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the AST classes.
 *
 * This module handles:
 * - Leaf nodes as {"tag": "NUM", "value": 1}
 * - Branch nodes as {"tag": "SUMOP", "children": [...]}
 * - Integral NUM values as Long (BigInteger past the long range), fractional ones as Double
 * - Validation of tags and value types while reading; NUM values must not be negative
 */
public class AstModule extends SimpleModule {

    static final String TAG = "tag";
    static final String VALUE = "value";
    static final String CHILDREN = "children";
    static final String ROOT = "$";

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.flowexpr", "flowexpr-jackson"));

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer<>(Node.class));
        addDeserializer(Leaf.class, new NodeDeserializer<>(Leaf.class));
        addDeserializer(Branch.class, new NodeDeserializer<>(Branch.class));
    }

    // ==================== Serialization ====================

    private static class NodeSerializer extends StdSerializer<Node> {
        private final NumberValueSerializer valueSerializer = new NumberValueSerializer();

        NodeSerializer() {
            super(Node.class);
        }

        @Override
        public void serialize(Node node, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField(TAG, node.tag().name());
            if (node instanceof Leaf leaf) {
                gen.writeFieldName(VALUE);
                valueSerializer.serialize(leaf.value(), gen, provider);
            } else {
                gen.writeArrayFieldStart(CHILDREN);
                for (Node child : ((Branch) node).children()) {
                    serialize(child, gen, provider);
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }
    }

    // ==================== Deserialization ====================

    /**
     * A well-formed JSON document that does not describe a valid tree.
     */
    static class NodeFormatException extends JsonMappingException {
        private final String problem;
        private final String path;

        NodeFormatException(JsonParser p, String message, String path) {
            this(p, message, path, null);
        }

        NodeFormatException(JsonParser p, String message, String path, Throwable cause) {
            super(p, message + " at " + path, cause);
            this.problem = message;
            this.path = path;
        }

        String problem() {
            return problem;
        }

        String path() {
            return path;
        }
    }

    private static class NodeDeserializer<T extends Node> extends StdDeserializer<T> {
        private final Class<T> type;

        NodeDeserializer(Class<T> type) {
            super(type);
            this.type = type;
        }

        @Override
        public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = p.readValueAsTree();
            Node node = toNode(tree, p, ROOT);
            if (!type.isInstance(node)) {
                throw new NodeFormatException(p,
                    "Expected " + type.getSimpleName() + " but found " + node.getClass().getSimpleName(), ROOT);
            }
            return type.cast(node);
        }

        private Node toNode(JsonNode json, JsonParser p, String path) throws JsonMappingException {
            if (json == null || !json.isObject()) {
                throw new NodeFormatException(p, "Expected an object", path);
            }
            JsonNode tagField = json.get(TAG);
            if (tagField == null || !tagField.isTextual()) {
                throw new NodeFormatException(p, "Missing '" + TAG + "'", path);
            }

            Tag tag;
            try {
                tag = Tag.valueOf(tagField.asText());
            } catch (IllegalArgumentException e) {
                throw new NodeFormatException(p, "Unknown tag '" + tagField.asText() + "'", path, e);
            }

            if (tag.isLeaf()) {
                return new Leaf(tag, toValue(tag, json.get(VALUE), p, path));
            }

            JsonNode children = json.get(CHILDREN);
            if (children == null || !children.isArray()) {
                throw new NodeFormatException(p, "Missing '" + CHILDREN + "' array", path);
            }
            List<Node> nodes = new ArrayList<>(children.size());
            for (int i = 0; i < children.size(); i++) {
                nodes.add(toNode(children.get(i), p, path + "." + CHILDREN + "[" + i + "]"));
            }
            return new Branch(tag, nodes);
        }

        private Object toValue(Tag tag, JsonNode value, JsonParser p, String path) throws JsonMappingException {
            if (value == null || value.isNull()) {
                throw new NodeFormatException(p, "Missing '" + VALUE + "'", path);
            }
            if (tag == Tag.NUM) {
                Number number;
                if (value.isIntegralNumber()) {
                    number = value.canConvertToLong() ? (Number) value.longValue() : value.bigIntegerValue();
                } else if (value.isFloatingPointNumber()) {
                    number = value.doubleValue();
                } else {
                    throw new NodeFormatException(p, "NUM value must be a number", path);
                }
                // Literals carry no sign; a negative number is UNOP(-, NUM)
                if (isNegative(number)) {
                    throw new NodeFormatException(p, "NUM value must not be negative", path);
                }
                return number;
            }
            if (!value.isTextual()) {
                throw new NodeFormatException(p, tag + " value must be a string", path);
            }
            return value.textValue();
        }

        private static boolean isNegative(Number number) {
            if (number instanceof BigInteger big) {
                return big.signum() < 0;
            }
            if (number instanceof Double d) {
                return Double.compare(d, 0.0) < 0;
            }
            return number.longValue() < 0;
        }
    }
}
