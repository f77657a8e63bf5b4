package org.oldskooler.modelforge.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NamesTest {

    @Test
    void toSnake_splitsCamelCase() {
        assertEquals("placed_at", Names.toSnake("placedAt"));
        assertEquals("user_id", Names.toSnake("userID"));
        assertEquals("already_snake", Names.toSnake("already_snake"));
    }

    @Test
    void toTitle_handlesBothNamingStyles() {
        assertEquals("Dynamic Column", Names.toTitle("dynamic_column"));
        assertEquals("Dynamic Column", Names.toTitle("dynamicColumn"));
        assertEquals("Id", Names.toTitle("id"));
        assertEquals("Ge Le", Names.toTitle("geLe"));
    }
}
