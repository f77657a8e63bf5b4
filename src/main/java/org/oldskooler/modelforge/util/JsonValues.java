package org.oldskooler.modelforge.util;

import com.google.gson.*;
import org.oldskooler.modelforge.mapping.EnumMember;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Bridges plain Java values and Gson's JSON tree.
 */
public final class JsonValues {
    private JsonValues() {}

    public static JsonElement toJson(Object value) {
        if (value == null) return JsonNull.INSTANCE;
        if (value instanceof JsonElement) return (JsonElement) value;
        if (value instanceof Boolean) return new JsonPrimitive((Boolean) value);
        if (value instanceof Number) return new JsonPrimitive((Number) value);
        if (value instanceof Character) return new JsonPrimitive((Character) value);
        if (value instanceof CharSequence) return new JsonPrimitive(value.toString());
        if (value instanceof Enum) return new JsonPrimitive(EnumMember.valueOf((Enum<?>) value));
        if (value instanceof java.sql.Date) return new JsonPrimitive(((java.sql.Date) value).toLocalDate().toString());
        if (value instanceof java.sql.Timestamp) return new JsonPrimitive(((java.sql.Timestamp) value).toLocalDateTime().toString());
        if (value instanceof Date) return new JsonPrimitive(((Date) value).toInstant().toString());

        if (value instanceof Map) {
            JsonObject obj = new JsonObject();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                obj.add(String.valueOf(e.getKey()), toJson(e.getValue()));
            }
            return obj;
        }
        if (value instanceof Iterable) {
            JsonArray arr = new JsonArray();
            for (Object item : (Iterable<?>) value) arr.add(toJson(item));
            return arr;
        }
        if (value.getClass().isArray()) {
            JsonArray arr = new JsonArray();
            int n = Array.getLength(value);
            for (int i = 0; i < n; i++) arr.add(toJson(Array.get(value, i)));
            return arr;
        }
        // java.time types, UUID and the like: ISO / canonical text form
        return new JsonPrimitive(value.toString());
    }

    /**
     * Converts a JSON tree to plain Java values: objects to ordered maps, arrays to lists,
     * whole numbers to Long (BigInteger when out of range), other numbers to Double.
     */
    public static Object fromJson(JsonElement element) {
        if (element == null || element.isJsonNull()) return null;
        if (element.isJsonObject()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> e : element.getAsJsonObject().entrySet()) {
                out.put(e.getKey(), fromJson(e.getValue()));
            }
            return out;
        }
        if (element.isJsonArray()) {
            List<Object> out = new ArrayList<>();
            for (JsonElement e : element.getAsJsonArray()) out.add(fromJson(e));
            return out;
        }
        JsonPrimitive p = element.getAsJsonPrimitive();
        if (p.isBoolean()) return p.getAsBoolean();
        if (p.isNumber()) return toNumber(p.getAsString());
        return p.getAsString();
    }

    /** Parses a JSON object literal into an ordered map. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed JSON: " + json, e);
        }
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("Expected a JSON object but got: " + json);
        }
        return (Map<String, Object>) fromJson(element);
    }

    /** Parses a JSON array literal into a list. */
    @SuppressWarnings("unchecked")
    public static List<Object> parseArray(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed JSON: " + json, e);
        }
        if (!element.isJsonArray()) {
            throw new IllegalArgumentException("Expected a JSON array but got: " + json);
        }
        return (List<Object>) fromJson(element);
    }

    private static Number toNumber(String text) {
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            BigInteger big = new BigInteger(text);
            return big.bitLength() < 64 ? (Number) big.longValue() : big;
        }
        return new BigDecimal(text).doubleValue();
    }
}
