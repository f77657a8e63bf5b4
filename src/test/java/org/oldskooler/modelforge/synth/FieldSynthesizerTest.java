package org.oldskooler.modelforge.synth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.oldskooler.modelforge.InvalidConstraintException;
import org.oldskooler.modelforge.InvalidDefaultException;
import org.oldskooler.modelforge.UnsupportedTypeException;
import org.oldskooler.modelforge.annotations.Column;
import org.oldskooler.modelforge.annotations.Id;
import org.oldskooler.modelforge.annotations.Info;
import org.oldskooler.modelforge.constraint.FieldKind;
import org.oldskooler.modelforge.mapping.ColumnMeta;
import org.oldskooler.modelforge.mapping.EntityMapping;
import org.oldskooler.modelforge.mapping.MappingRegistry;
import org.oldskooler.modelforge.mapping.TableMeta;
import org.oldskooler.modelforge.models.Bool;
import org.oldskooler.modelforge.models.PersonRecord;
import org.oldskooler.modelforge.models.TicketRecord;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldSynthesizerTest {

    static class Odd {
        Map<String, String> attributes;

        @Column(defaultValue = "abc")
        int count;

        @Info("{\"const\": true}")
        String code;

        @Column(doc = "From the column")
        @Info("{\"description\": \"From the metadata\"}")
        String described;

        @Column(doc = "Only the column")
        String documented;

        int[] scores;

        List<?> measures;
    }

    private FieldSynthesizer synthesizer;
    private SynthesisContext context;

    @BeforeEach
    void setUp() {
        synthesizer = new FieldSynthesizer();
        context = new SynthesisContext();
    }

    private static ColumnMeta column(Class<?> type, String property) {
        return TableMeta.of(type).columns.get(property);
    }

    @Test
    void primaryKey_isOptionalButRequired() {
        FieldSpec id = synthesizer.synthesize(column(PersonRecord.class, "id"), context);

        assertEquals(FieldKind.INTEGER, id.type().kind());
        assertTrue(id.type().isOptional());
        assertTrue(id.isRequired());
    }

    @Test
    void primaryKeyDefault_isIgnored() {
        MappingRegistry registry = new MappingRegistry().register(EntityMapping.builder(PersonRecord.class)
                .column("id", c -> c.primaryKey().defaultValue(5))
                .build());
        ColumnMeta id = TableMeta.of(PersonRecord.class, registry).columns.get("id");

        assertTrue(synthesizer.synthesize(id, context).isRequired());
    }

    @Test
    void nonNullableWithoutDefault_isRequired() {
        FieldSpec name = synthesizer.synthesize(column(PersonRecord.class, "name"), context);

        assertFalse(name.type().isOptional());
        assertTrue(name.isRequired());
        assertEquals(128, name.constraints().getString().getMaxLength());
        assertEquals("Full name", name.constraints().getDescription());
    }

    @Test
    void staticDefault_isConvertedToFieldType() {
        FieldSpec age = synthesizer.synthesize(column(PersonRecord.class, "age"), context);

        assertFalse(age.type().isOptional());
        assertTrue(age.hasDefaultValue());
        assertEquals(0, age.defaultValue());
    }

    @Test
    void nullableWithoutDefault_defaultsToNull() {
        FieldSpec priority = synthesizer.synthesize(column(TicketRecord.class, "priority"), context);

        assertTrue(priority.type().isOptional());
        assertTrue(priority.hasDefaultValue());
        assertNull(priority.defaultValue());
    }

    @Test
    void enumDefault_resolvesMemberValue() {
        FieldSpec open = synthesizer.synthesize(column(TicketRecord.class, "open"), context);

        assertEquals(FieldKind.ENUM, open.type().kind());
        assertEquals("Bool", open.type().enumDefinition().name());
        assertEquals(Bool.TRUE, open.defaultValue());
    }

    @Test
    void sequenceDefault_isParsedFromJson() {
        FieldSpec labels = synthesizer.synthesize(column(TicketRecord.class, "labels"), context);

        assertEquals(FieldKind.SEQUENCE, labels.type().kind());
        assertEquals(FieldKind.STRING, labels.type().itemType().kind());
        assertFalse(labels.type().isUnique());
        assertEquals(Collections.singletonList("triage"), labels.defaultValue());
        assertEquals(3, labels.constraints().getSequence().getMaxItems());
    }

    @Test
    void enumDefinitions_areSharedWithinOneRun() {
        FieldSpec open = synthesizer.synthesize(column(TicketRecord.class, "open"), context);
        FieldSpec flags = synthesizer.synthesize(column(TicketRecord.class, "flags"), context);

        assertTrue(flags.type().isUnique());
        assertSame(open.type().enumDefinition(), flags.type().itemType().enumDefinition());
        assertEquals(1, context.definitions().size());
    }

    @Test
    void defaultFactory_isCalledPerDefault() {
        FieldSpec createdAt = synthesizer.synthesize(column(TicketRecord.class, "createdAt"), context);

        assertEquals(FieldKind.DATE_TIME, createdAt.type().kind());
        assertTrue(createdAt.hasDefaultFactory());
        assertFalse(createdAt.isRequired());
        assertTrue(createdAt.newDefault() instanceof LocalDateTime);
    }

    @Test
    void unsupportedType_isRejected() {
        UnsupportedTypeException ex = assertThrows(UnsupportedTypeException.class,
                () -> synthesizer.synthesize(column(Odd.class, "attributes"), context));
        assertEquals("attributes", ex.getField());
    }

    @Test
    void unconvertibleDefault_isRejected() {
        InvalidDefaultException ex = assertThrows(InvalidDefaultException.class,
                () -> synthesizer.synthesize(column(Odd.class, "count"), context));
        assertEquals("count", ex.getField());
    }

    @Test
    void constWithoutStaticDefault_isRejected() {
        assertThrows(InvalidConstraintException.class,
                () -> synthesizer.synthesize(column(Odd.class, "code"), context));
    }

    @Test
    void metadataDescription_winsOverColumnDoc() {
        assertEquals("From the metadata",
                synthesizer.synthesize(column(Odd.class, "described"), context).constraints().getDescription());
        assertEquals("Only the column",
                synthesizer.synthesize(column(Odd.class, "documented"), context).constraints().getDescription());
    }

    @Test
    void arraysAndWildcards_becomeSequences() {
        FieldSpec scores = synthesizer.synthesize(column(Odd.class, "scores"), context);
        assertEquals(FieldKind.SEQUENCE, scores.type().kind());
        assertEquals(FieldKind.INTEGER, scores.type().itemType().kind());

        FieldSpec measures = synthesizer.synthesize(column(Odd.class, "measures"), context);
        assertEquals(FieldKind.SEQUENCE, measures.type().kind());
        assertEquals(FieldKind.ANY, measures.type().itemType().kind());
    }

    @Test
    void newDefault_copiesCollections() {
        FieldSpec labels = synthesizer.synthesize(column(TicketRecord.class, "labels"), context);

        Object first = labels.newDefault();
        assertEquals(Arrays.asList("triage"), first);
        assertNotSame(first, labels.newDefault());
    }

    static class Keyed {
        @Id
        @Column(defaultValue = "7")
        Integer id;
    }

    @Test
    void annotatedPrimaryKeyDefault_isIgnored() {
        FieldSpec id = synthesizer.synthesize(column(Keyed.class, "id"), context);
        assertTrue(id.isRequired());
        assertNull(id.defaultValue());
    }
}
