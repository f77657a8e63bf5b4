package org.oldskooler.modelforge;

import org.junit.jupiter.api.Test;
import org.oldskooler.modelforge.mapping.EntityMapping;
import org.oldskooler.modelforge.model.ModelInstance;
import org.oldskooler.modelforge.model.ValidatedModel;
import org.oldskooler.modelforge.models.PersonRecord;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelForgeTest {

    @Test
    void person_roundTripsThroughRecord() {
        ValidatedModel person = ModelForge.modelFrom(PersonRecord.class);

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("name", "Someone");
        input.put("age", 25);
        ModelInstance built = person.construct(input);

        // what a store would hand back after assigning the identity
        PersonRecord stored = new PersonRecord(1, (Integer) built.get("age"), (String) built.get("name"));

        ModelInstance loaded = person.fromRecord(stored);
        assertEquals("PersonRecord(id=1, age=25, name=Someone)", loaded.toString());
        assertEquals("{\"id\":1,\"age\":25,\"name\":\"Someone\"}", loaded.toJson());
    }

    @Test
    void registeredMapping_isUsedByInstanceOnly() {
        ModelForge forge = new ModelForge().map(EntityMapping.builder(PersonRecord.class)
                .column("id", c -> c.primaryKey())
                .column("name", c -> c.nullable(false).info("min_length", 2))
                .build());

        ValidatedModel mapped = forge.model(PersonRecord.class);
        assertEquals(2, mapped.fields().size());
        assertEquals(2, mapped.field("name").constraints().getString().getMinLength());
        assertTrue(forge.mappingRegistry().contains(PersonRecord.class));

        assertEquals(3, ModelForge.modelFrom(PersonRecord.class).fields().size());
    }

    @Test
    void failedSynthesis_producesNoModel() {
        ModelForge forge = new ModelForge().map(EntityMapping.builder(PersonRecord.class)
                .column("name", c -> c.length(8).info("max_length", 9))
                .build());

        ConstraintConflictException ex = assertThrows(ConstraintConflictException.class,
                () -> forge.model(PersonRecord.class));
        assertEquals("max_length", ex.getKey());
    }
}
