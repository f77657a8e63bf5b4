package org.oldskooler.modelforge.constraint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintKeyTest {

    @Test
    void byKey_findsVocabularyEntries() {
        assertEquals(ConstraintKey.MULTIPLE_OF, ConstraintKey.byKey("multiple_of").orElseThrow(AssertionError::new));
        assertEquals("multipleOf", ConstraintKey.MULTIPLE_OF.schemaKeyword());
        assertFalse(ConstraintKey.byKey("x-unit").isPresent());
    }

    @Test
    void alias_hasNoSchemaKeyword() {
        assertNull(ConstraintKey.ALIAS.schemaKeyword());
    }

    @Test
    void legalFor_followsScope() {
        assertTrue(ConstraintKey.GE.legalFor(FieldKind.INTEGER));
        assertTrue(ConstraintKey.GE.legalFor(FieldKind.NUMBER));
        assertFalse(ConstraintKey.GE.legalFor(FieldKind.STRING));

        assertTrue(ConstraintKey.REGEX.legalFor(FieldKind.STRING));
        assertFalse(ConstraintKey.REGEX.legalFor(FieldKind.DATE_TIME));

        assertTrue(ConstraintKey.MAX_ITEMS.legalFor(FieldKind.SEQUENCE));
        assertFalse(ConstraintKey.MAX_ITEMS.legalFor(FieldKind.STRING));

        for (FieldKind kind : FieldKind.values()) {
            assertTrue(ConstraintKey.TITLE.legalFor(kind), kind.name());
            assertTrue(ConstraintKey.ALLOW_MUTATION.legalFor(kind), kind.name());
        }
    }
}
