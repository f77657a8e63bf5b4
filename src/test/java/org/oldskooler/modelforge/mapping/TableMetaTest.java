package org.oldskooler.modelforge.mapping;

import org.junit.jupiter.api.Test;
import org.oldskooler.modelforge.annotations.Column;
import org.oldskooler.modelforge.annotations.Info;
import org.oldskooler.modelforge.models.PersonRecord;
import org.oldskooler.modelforge.models.TicketRecord;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class TableMetaTest {

    static class BadInfo {
        @Info("{ge: ")
        Integer age;
    }

    static class BothDefaults {
        @Column(defaultValue = "1", defaultFactory = One.class)
        Integer value;
    }

    static class One implements Supplier<Integer> {
        @Override
        public Integer get() {
            return 1;
        }
    }

    interface NotARecord {
    }

    @Test
    void annotations_giveColumnsInDeclarationOrder() {
        TableMeta<TicketRecord> meta = TableMeta.of(TicketRecord.class);

        assertSame(TicketRecord.class, meta.type);
        assertEquals(Arrays.asList("id", "title", "open", "priority", "labels", "flags", "createdAt"),
                Arrays.asList(meta.columns.keySet().toArray()));
        assertTrue(meta.columns.get("id").primaryKey);
        assertEquals(LocalDateTime.class, meta.columns.get("createdAt").javaType);
    }

    @Test
    void notMappedAndTransientFields_areSkipped() {
        TableMeta<TicketRecord> meta = TableMeta.of(TicketRecord.class);

        assertFalse(meta.columns.containsKey("scratch"));
        assertFalse(meta.columns.containsKey("hits"));
    }

    @Test
    void columnHints_areRead() {
        TableMeta<PersonRecord> meta = TableMeta.of(PersonRecord.class);

        ColumnMeta id = meta.columns.get("id");
        assertTrue(id.primaryKey);
        assertTrue(id.nullable);

        ColumnMeta age = meta.columns.get("age");
        assertFalse(age.nullable);
        assertTrue(age.defaultValue.isValue());
        assertEquals("0", age.defaultValue.value());
        assertEquals("Age in years", age.doc);

        ColumnMeta name = meta.columns.get("name");
        assertEquals(128, name.length);
        assertTrue(name.hasLength());
        assertFalse(age.hasLength());
    }

    @Test
    void defaultFactory_isInstantiated() {
        ColumnMeta createdAt = TableMeta.of(TicketRecord.class).columns.get("createdAt");

        assertTrue(createdAt.defaultValue.isFactory());
        assertNotNull(createdAt.defaultValue.factory().get());
    }

    @Test
    void infoJson_isParsed_andEnumMembersAreListed() {
        TableMeta<TicketRecord> meta = TableMeta.of(TicketRecord.class);

        assertEquals(3L, meta.columns.get("labels").info.get("max_items"));

        List<EnumMember> members = meta.columns.get("open").enumMembers();
        assertEquals(2, members.size());
        assertEquals("FALSE", members.get(0).name);
        assertEquals("F", members.get(0).value);
        assertTrue(meta.columns.get("title").enumMembers().isEmpty());
    }

    @Test
    void malformedInfo_isRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> TableMeta.of(BadInfo.class));
        assertTrue(ex.getMessage().contains("BadInfo.age"), ex.getMessage());
    }

    @Test
    void bothDefaultKinds_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> TableMeta.of(BothDefaults.class));
    }

    @Test
    void interfaces_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> TableMeta.of(NotARecord.class));
    }

    @Test
    void registeredMapping_winsOverAnnotations() {
        MappingRegistry registry = new MappingRegistry()
                .register(EntityMapping.builder(PersonRecord.class)
                        .column("id", c -> c.primaryKey())
                        .column("name", c -> c.nullable(false).info("min_length", 1))
                        .build());

        TableMeta<PersonRecord> meta = TableMeta.of(PersonRecord.class, registry);

        assertEquals(Arrays.asList("id", "name"), Arrays.asList(meta.columns.keySet().toArray()));
        assertEquals(-1, meta.columns.get("name").length);
        assertEquals(1, meta.columns.get("name").info.get("min_length"));
    }
}
