package com.syntree.jackson;

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
import com.syntree.AstException;
import com.syntree.ast.DeclaredSymbol;
import com.syntree.ast.Node;
import com.syntree.ast.NodeKind;
import com.syntree.ast.Nodes;
import com.syntree.ast.PayloadClass;
import com.syntree.ast.SourceLocation;
import com.syntree.ast.Symbol;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Jackson module that reads and writes {@link Node} trees.
 *
 * Every node is an object with a {@code kind} (the kind's display name) and
 * one payload field chosen by the kind's payload class:
 * - {@code intVal} for integer literals
 * - {@code floatVal} for float literals (see {@link FloatLiteralSerializer})
 * - {@code strVal} for strings, comments, identifiers and symbols, plus a
 *   {@code symbol} object for symbols
 * - {@code children} for compound kinds
 * Nodes with a known source location also get a {@code loc} object unless
 * locations are switched off.
 *
 * Unsigned 64-bit literals holding a value above {@code Long.MAX_VALUE} are
 * written as their unsigned decimal value.
 *
 * Reading rebuilds the tree through {@link Nodes}, so shape violations in the
 * input surface as errors instead of producing a malformed tree. A payload
 * field that does not belong to the node's kind, or an integer that does not
 * fit the kind, is an error as well.
 */
public class NodeModule extends SimpleModule {

    private static final BigInteger UNSIGNED_LIMIT = BigInteger.ONE.shiftLeft(64);

    /** Payload field names and the payload class each belongs to. */
    private static final Map<String, PayloadClass> PAYLOAD_FIELDS = Map.of(
        "intVal", PayloadClass.INTEGER,
        "floatVal", PayloadClass.FLOAT,
        "strVal", PayloadClass.TEXT,
        "children", PayloadClass.CHILDREN);

    public NodeModule() {
        this(true);
    }

    public NodeModule(boolean writeLocations) {
        super("NodeModule", new Version(0, 1, 0, null, "com.syntree", "syntree-jackson"));
        addSerializer(Node.class, new NodeSerializer(writeLocations));
        addDeserializer(Node.class, new NodeDeserializer());
    }

    private static boolean isUnsigned64(NodeKind kind) {
        return kind == NodeKind.UINT_LIT || kind == NodeKind.UINT64_LIT;
    }

    // ==================== Serialization ====================

    static class NodeSerializer extends StdSerializer<Node> {
        private static final FloatLiteralSerializer FLOATS = new FloatLiteralSerializer();

        private final boolean writeLocations;

        NodeSerializer(boolean writeLocations) {
            super(Node.class);
            this.writeLocations = writeLocations;
        }

        @Override
        public void serialize(Node node, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("kind", node.kind().displayName());
            switch (node.kind().payloadClass()) {
                case INTEGER:
                    if (isUnsigned64(node.kind()) && node.intValue() < 0) {
                        gen.writeFieldName("intVal");
                        gen.writeNumber(new BigInteger(Long.toUnsignedString(node.intValue())));
                    } else {
                        gen.writeNumberField("intVal", node.intValue());
                    }
                    break;
                case FLOAT:
                    gen.writeFieldName("floatVal");
                    FLOATS.serialize(node.floatValue(), gen, provider);
                    break;
                case TEXT:
                    gen.writeStringField("strVal", node.textValue());
                    if (node.kind() == NodeKind.SYM) {
                        writeSymbol(node.symbol(), gen);
                    }
                    break;
                case CHILDREN:
                    gen.writeArrayFieldStart("children");
                    for (Node child : node) {
                        serialize(child, gen, provider);
                    }
                    gen.writeEndArray();
                    break;
                default:
                    break;
            }
            if (writeLocations && node.location().isKnown()) {
                writeLocation(node.location(), gen);
            }
            gen.writeEndObject();
        }

        private void writeSymbol(Symbol symbol, JsonGenerator gen) throws IOException {
            gen.writeObjectFieldStart("symbol");
            gen.writeNumberField("id", symbol.id());
            gen.writeStringField("name", symbol.name());
            gen.writeStringField("scope", symbol.scope());
            gen.writeStringField("declaredType", symbol.declaredType());
            gen.writeEndObject();
        }

        private void writeLocation(SourceLocation location, JsonGenerator gen) throws IOException {
            gen.writeObjectFieldStart("loc");
            writePosition("start", location.start(), gen);
            writePosition("end", location.end(), gen);
            gen.writeEndObject();
        }

        private void writePosition(String field, SourceLocation.Position position, JsonGenerator gen)
                throws IOException {
            gen.writeObjectFieldStart(field);
            gen.writeNumberField("line", position.line());
            gen.writeNumberField("column", position.column());
            gen.writeEndObject();
        }
    }

    // ==================== Deserialization ====================

    static class NodeDeserializer extends StdDeserializer<Node> {

        NodeDeserializer() {
            super(Node.class);
        }

        @Override
        public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode json = p.getCodec().readTree(p);
            return build(json, ctxt);
        }

        private Node build(JsonNode json, DeserializationContext ctxt) throws IOException {
            if (json == null || !json.isObject()) {
                throw JsonMappingException.from(ctxt, "Expected a node object but got " + json);
            }
            NodeKind kind = kindOf(json, ctxt);
            Node node;
            try {
                node = payloadNode(kind, json, ctxt);
            } catch (AstException | IllegalArgumentException e) {
                throw JsonMappingException.from(ctxt, "Invalid " + kind.displayName() + " node: " + e.getMessage(), e);
            }
            JsonNode loc = json.get("loc");
            if (loc != null && !node.isAbsent()) {
                node.setLocation(readLocation(loc, ctxt));
            }
            return node;
        }

        private Node payloadNode(NodeKind kind, JsonNode json, DeserializationContext ctxt) throws IOException {
            rejectForeignPayload(kind, json);
            switch (kind.payloadClass()) {
                case NONE:
                    return kind == NodeKind.EMPTY ? Nodes.empty() : Node.of(kind);
                case INTEGER:
                    JsonNode intVal = json.get("intVal");
                    if (intVal == null || !intVal.isIntegralNumber()) {
                        throw new IllegalArgumentException("missing integral intVal");
                    }
                    return Nodes.scalar(kind, readInteger(kind, intVal));
                case FLOAT:
                    return Nodes.scalar(kind, FloatLiteralSerializer.read(json.get("floatVal")));
                case TEXT:
                    JsonNode strVal = json.get("strVal");
                    if (strVal == null || !strVal.isTextual()) {
                        throw new IllegalArgumentException("missing strVal");
                    }
                    if (kind == NodeKind.SYM) {
                        JsonNode symbol = json.get("symbol");
                        if (symbol == null) {
                            throw new IllegalArgumentException("missing symbol");
                        }
                        return Nodes.ident(strVal.asText()).resolve(readSymbol(symbol));
                    }
                    return Nodes.text(kind, strVal.asText());
                default:
                    JsonNode children = json.get("children");
                    List<Node> built = new ArrayList<>();
                    if (children != null) {
                        if (!children.isArray()) {
                            throw new IllegalArgumentException("children must be an array");
                        }
                        for (JsonNode child : children) {
                            built.add(build(child, ctxt));
                        }
                    }
                    return Nodes.compound(kind, built);
            }
        }

        /**
         * Rejects payload fields of other payload classes, and a symbol on
         * anything but a Sym node.
         */
        private void rejectForeignPayload(NodeKind kind, JsonNode json) {
            for (Map.Entry<String, PayloadClass> field : PAYLOAD_FIELDS.entrySet()) {
                if (json.has(field.getKey()) && field.getValue() != kind.payloadClass()) {
                    throw new IllegalArgumentException(
                        "field '" + field.getKey() + "' does not belong to a " + kind.payloadClass() + " payload");
                }
            }
            if (json.has("symbol") && kind != NodeKind.SYM) {
                throw new IllegalArgumentException("only Sym nodes carry a symbol");
            }
        }

        private long readInteger(NodeKind kind, JsonNode intVal) {
            if (intVal.canConvertToLong()) {
                return intVal.longValue();
            }
            BigInteger value = intVal.bigIntegerValue();
            if (isUnsigned64(kind) && value.signum() >= 0 && value.compareTo(UNSIGNED_LIMIT) < 0) {
                // stored as the two's complement bit pattern
                return value.longValue();
            }
            throw new IllegalArgumentException(value + " does not fit in a " + kind.displayName());
        }

        private Symbol readSymbol(JsonNode json) {
            if (!json.isObject() || !json.path("id").isIntegralNumber() || !json.path("name").isTextual()) {
                throw new IllegalArgumentException("symbol needs an integral id and a name");
            }
            return new DeclaredSymbol(
                json.get("id").longValue(),
                json.get("name").asText(),
                json.path("scope").asText(""),
                json.path("declaredType").asText(""));
        }

        private SourceLocation readLocation(JsonNode loc, DeserializationContext ctxt) throws JsonMappingException {
            JsonNode start = loc.path("start");
            JsonNode end = loc.path("end");
            if (!start.isObject() || !end.isObject()) {
                throw JsonMappingException.from(ctxt, "loc needs start and end positions: " + loc);
            }
            return SourceLocation.of(
                start.path("line").asInt(), start.path("column").asInt(),
                end.path("line").asInt(), end.path("column").asInt());
        }

        private NodeKind kindOf(JsonNode json, DeserializationContext ctxt) throws JsonMappingException {
            JsonNode kind = json.get("kind");
            if (kind == null || !kind.isTextual()) {
                throw JsonMappingException.from(ctxt, "Node object without a kind: " + json);
            }
            try {
                return NodeKind.fromDisplayName(kind.asText());
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(ctxt, e.getMessage(), e);
            }
        }
    }
}
