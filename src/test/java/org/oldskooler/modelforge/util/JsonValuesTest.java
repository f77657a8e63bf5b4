package org.oldskooler.modelforge.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Test;
import org.oldskooler.modelforge.models.Bool;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonValuesTest {

    @Test
    void parseObject_keepsOrderAndNarrowsNumbers() {
        Map<String, Object> m = JsonValues.parseObject("{\"b\": 1, \"a\": 2.5, \"c\": [true, \"x\"]}");

        assertEquals(Arrays.asList("b", "a", "c"), Arrays.asList(m.keySet().toArray()));
        assertEquals(1L, m.get("b"));
        assertEquals(2.5, m.get("a"));
        assertEquals(Arrays.asList(true, "x"), m.get("c"));
    }

    @Test
    void parseObject_rejectsMalformedOrNonObjectJson() {
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parseObject("{ge: "));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parseObject("[1]"));
    }

    @Test
    void parseArray_readsList() {
        List<Object> items = JsonValues.parseArray("[\"triage\", 3]");
        assertEquals(Arrays.asList("triage", 3L), items);
    }

    @Test
    void toJson_writesEnumValuesAndIsoDates() {
        assertEquals(new JsonPrimitive("T"), JsonValues.toJson(Bool.TRUE));
        assertEquals(new JsonPrimitive("2025-01-02T03:04:05"),
                JsonValues.toJson(LocalDateTime.of(2025, 1, 2, 3, 4, 5)));

        JsonArray arr = JsonValues.toJson(Arrays.asList(Bool.FALSE, 1)).getAsJsonArray();
        assertEquals("F", arr.get(0).getAsString());
        assertEquals(1, arr.get(1).getAsInt());
    }
}
