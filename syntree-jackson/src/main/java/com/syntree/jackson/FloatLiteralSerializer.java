package com.syntree.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes float literal payloads so that every value survives a round trip.
 * JSON has no NaN or infinity, so those are written as the strings
 * {@code "NaN"}, {@code "Inf"} and {@code "-Inf"}.
 */
public class FloatLiteralSerializer extends JsonSerializer<Double> {

    static final String NAN = "NaN";
    static final String INF = "Inf";
    static final String NEG_INF = "-Inf";

    @Override
    public void serialize(Double value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value.isNaN()) {
            gen.writeString(NAN);
        } else if (value == Double.POSITIVE_INFINITY) {
            gen.writeString(INF);
        } else if (value == Double.NEGATIVE_INFINITY) {
            gen.writeString(NEG_INF);
        } else {
            gen.writeNumber(value);
        }
    }

    /**
     * Reads a value written by {@link #serialize}.
     *
     * @throws IllegalArgumentException if the JSON value is neither a number nor a known special value
     */
    static double read(JsonNode json) {
        if (json == null || json.isNull()) {
            throw new IllegalArgumentException("missing floatVal");
        }
        if (json.isNumber()) {
            return json.doubleValue();
        }
        switch (json.asText()) {
            case NAN:
                return Double.NaN;
            case INF:
                return Double.POSITIVE_INFINITY;
            case NEG_INF:
                return Double.NEGATIVE_INFINITY;
            default:
                throw new IllegalArgumentException("not a float value: " + json);
        }
    }
}
