package org.oldskooler.modelforge.mapping;

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Read-only description of one record model column, as consumed by the synthesizers. */
public final class ColumnMeta {
    public final String property;       // entity field name, also the synthesized field name
    public final Class<?> javaType;     // declared field type
    public final Type genericType;      // declared generic type, for List<T> and friends
    public final boolean nullable;
    public final boolean primaryKey;
    public final ColumnDefault defaultValue;
    public final int length;            // declared bounded-string length; -1 when unbounded
    public final Map<String, Object> info;  // free-form metadata bag
    public final String doc;

    public ColumnMeta(String property, Class<?> javaType, Type genericType,
                      boolean nullable, boolean primaryKey, ColumnDefault defaultValue,
                      int length, Map<String, Object> info, String doc) {
        this.property = Objects.requireNonNull(property, "property");
        this.javaType = Objects.requireNonNull(javaType, "javaType");
        this.genericType = genericType == null ? javaType : genericType;
        this.nullable = nullable;
        this.primaryKey = primaryKey;
        this.defaultValue = defaultValue == null ? ColumnDefault.none() : defaultValue;
        this.length = length;
        this.info = (info == null) ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(info));
        this.doc = doc == null ? "" : doc;
    }

    public boolean hasLength() {
        return length > 0;
    }

    /** Declared enum members, or an empty list for non-enum columns. */
    public List<EnumMember> enumMembers() {
        return javaType.isEnum() ? EnumMember.listOf(javaType) : Collections.emptyList();
    }

    @Override
    public String toString() {
        return "ColumnMeta{" + property + " " + javaType.getSimpleName()
                + (primaryKey ? " pk" : "")
                + (nullable ? " null" : " not null")
                + (hasLength() ? " length=" + length : "")
                + ", " + defaultValue
                + (info.isEmpty() ? "" : ", info=" + info)
                + "}";
    }
}
