package org.oldskooler.modelforge.schema;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.oldskooler.modelforge.constraint.FieldConstraints;
import org.oldskooler.modelforge.constraint.FieldKind;
import org.oldskooler.modelforge.constraint.NumericConstraints;
import org.oldskooler.modelforge.constraint.SequenceConstraints;
import org.oldskooler.modelforge.constraint.StringConstraints;
import org.oldskooler.modelforge.model.ValidatedModel;
import org.oldskooler.modelforge.synth.EnumDefinition;
import org.oldskooler.modelforge.synth.FieldSpec;
import org.oldskooler.modelforge.synth.FieldType;
import org.oldskooler.modelforge.util.JsonValues;
import org.oldskooler.modelforge.util.Names;

import java.util.Map;

/**
 * Renders a validated model as a JSON Schema object ({@code definitions}-style references).
 * <p>
 * Per property the keys come in a fixed order: title, description, default, the constraint
 * keywords, const, example, allow_mutation and other metadata, then the type keywords.
 * </p>
 */
public final class JsonSchemaWriter {
    private static final String DEFINITIONS_REF = "#/definitions/";

    private JsonSchemaWriter() {}

    public static JsonObject write(ValidatedModel model) {
        JsonObject schema = new JsonObject();
        String title = model.config().getTitle();
        schema.addProperty("title", title == null ? model.name() : title);
        schema.addProperty("type", "object");

        JsonObject properties = new JsonObject();
        JsonArray required = new JsonArray();
        for (FieldSpec field : model.fields()) {
            properties.add(field.alias(), property(field));
            if (field.isRequired()) {
                required.add(field.alias());
            }
        }
        schema.add("properties", properties);
        if (required.size() > 0) {
            schema.add("required", required);
        }

        if (!model.definitions().isEmpty()) {
            JsonObject definitions = new JsonObject();
            for (EnumDefinition def : model.definitions()) {
                definitions.add(def.name(), definition(def));
            }
            schema.add("definitions", definitions);
        }
        return schema;
    }

    static JsonObject definition(EnumDefinition def) {
        JsonObject out = new JsonObject();
        out.addProperty("title", def.enumType().getSimpleName());
        out.addProperty("description", "An enumeration.");
        JsonArray values = new JsonArray();
        for (String v : def.values()) values.add(v);
        out.add("enum", values);
        out.addProperty("type", "string");
        return out;
    }

    private static JsonObject property(FieldSpec field) {
        FieldConstraints c = field.constraints();
        FieldType type = field.type();
        JsonObject out = new JsonObject();

        if (c.getTitle() != null) {
            out.addProperty("title", c.getTitle());
        } else if (type.kind() != FieldKind.ENUM) {
            out.addProperty("title", Names.toTitle(field.alias()));
        }
        if (c.getDescription() != null) {
            out.addProperty("description", c.getDescription());
        }
        // factory results are not known up front; a null default says nothing
        if (field.hasDefaultValue() && field.defaultValue() != null) {
            out.add("default", JsonValues.toJson(field.defaultValue()));
        }

        writeNumeric(out, c.getNumeric());
        writeString(out, c.getString());
        writeSequence(out, c.getSequence());

        if (c.isConstant()) {
            out.add("const", JsonValues.toJson(field.defaultValue()));
        }
        if (c.hasExample()) {
            out.add("example", JsonValues.toJson(c.getExample()));
        }
        if (c.getAllowMutation() != null) {
            out.addProperty("allow_mutation", c.getAllowMutation());
        }
        for (Map.Entry<String, Object> e : c.getExtras().entrySet()) {
            out.add(e.getKey(), JsonValues.toJson(e.getValue()));
        }

        if (type.kind() == FieldKind.ENUM && out.size() > 0) {
            JsonArray allOf = new JsonArray();
            allOf.add(typeKeywords(type));
            out.add("allOf", allOf);
            return out;
        }
        for (Map.Entry<String, JsonElement> e : typeKeywords(type).entrySet()) {
            out.add(e.getKey(), e.getValue());
        }
        return out;
    }

    private static JsonObject typeKeywords(FieldType type) {
        JsonObject out = new JsonObject();
        switch (type.kind()) {
            case ANY:
                break;
            case ENUM:
                out.addProperty("$ref", DEFINITIONS_REF + type.enumDefinition().name());
                break;
            case SEQUENCE:
                out.addProperty("type", "array");
                out.add("items", typeKeywords(type.itemType()));
                if (type.isUnique()) {
                    out.addProperty("uniqueItems", true);
                }
                break;
            default:
                out.addProperty("type", type.kind().jsonType());
                if (type.kind().format() != null) {
                    out.addProperty("format", type.kind().format());
                }
        }
        return out;
    }

    private static void writeNumeric(JsonObject out, NumericConstraints n) {
        put(out, "minimum", n.getGe());
        put(out, "exclusiveMinimum", n.getGt());
        put(out, "maximum", n.getLe());
        put(out, "exclusiveMaximum", n.getLt());
        put(out, "multipleOf", n.getMultipleOf());
    }

    private static void writeString(JsonObject out, StringConstraints s) {
        put(out, "maxLength", s.getMaxLength());
        put(out, "minLength", s.getMinLength());
        if (s.getRegex() != null) {
            out.addProperty("pattern", s.getRegex().pattern());
        }
    }

    private static void writeSequence(JsonObject out, SequenceConstraints s) {
        put(out, "minItems", s.getMinItems());
        put(out, "maxItems", s.getMaxItems());
    }

    private static void put(JsonObject out, String keyword, Number value) {
        if (value != null) {
            out.add(keyword, new JsonPrimitive(value));
        }
    }
}
