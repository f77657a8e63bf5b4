package org.oldskooler.modelforge.synth;

import org.junit.jupiter.api.Test;
import org.oldskooler.modelforge.ConstraintConflictException;
import org.oldskooler.modelforge.InvalidConstraintException;
import org.oldskooler.modelforge.annotations.Column;
import org.oldskooler.modelforge.annotations.Id;
import org.oldskooler.modelforge.annotations.Info;
import org.oldskooler.modelforge.model.ModelConfig;
import org.oldskooler.modelforge.model.ValidatedModel;
import org.oldskooler.modelforge.models.TicketRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelSynthesizerTest {

    static class Audited {
        @Id
        Long id;
        String createdBy;
    }

    static class Invoice extends Audited {
        @Column(nullable = false)
        String number;
    }

    static class Conflicting {
        @Id
        Integer id;

        @Column(length = 64)
        @Info("{\"max_length\": 65}")
        String string;
    }

    static class Clashing {
        @Id
        Integer id;

        @Info("{\"alias\": \"id\"}")
        Integer other;
    }

    private final ModelSynthesizer synthesizer = new ModelSynthesizer();

    private static List<String> names(List<FieldSpec> fields) {
        List<String> out = new ArrayList<>();
        for (FieldSpec f : fields) out.add(f.name());
        return out;
    }

    @Test
    void fields_followDeclarationOrder_superclassFirst() {
        ModelSpec spec = synthesizer.describe(Invoice.class, null);

        assertEquals("Invoice", spec.name());
        assertEquals(Arrays.asList("id", "createdBy", "number"), names(spec.fields()));
    }

    @Test
    void ticket_model_hasOneFieldPerColumn() {
        ValidatedModel model = synthesizer.synthesize(TicketRecord.class);

        assertEquals("TicketRecord", model.name());
        assertEquals(Arrays.asList("id", "title", "open", "priority", "labels", "flags", "createdAt"),
                names(model.fields()));
        assertEquals(2, model.definitions().size());
        assertEquals("Bool", model.definitions().get(0).name());
        assertEquals("Priority", model.definitions().get(1).name());
    }

    @Test
    void firstFailingColumn_abortsSynthesis() {
        assertThrows(ConstraintConflictException.class, () -> synthesizer.synthesize(Conflicting.class));
    }

    @Test
    void sharedExternalName_isRejected() {
        InvalidConstraintException ex = assertThrows(InvalidConstraintException.class,
                () -> synthesizer.synthesize(Clashing.class));
        assertEquals("other", ex.getField());
    }

    @Test
    void everyCall_buildsADistinctModel() {
        ValidatedModel first = synthesizer.synthesize(TicketRecord.class);
        ValidatedModel second = synthesizer.synthesize(TicketRecord.class);

        assertNotSame(first, second);
        assertNotSame(first.definitions().get(0), second.definitions().get(0));
        assertEquals(names(first.fields()), names(second.fields()));
    }

    @Test
    void config_isPassedThroughUntouched() {
        ModelConfig config = ModelConfig.builder().validateAssignment(true).build();

        assertSame(config, synthesizer.describe(TicketRecord.class, config).config());
        assertSame(config, synthesizer.synthesize(TicketRecord.class, config).config());
        assertNull(synthesizer.describe(TicketRecord.class, null).config());
        assertSame(ModelConfig.DEFAULT, synthesizer.synthesize(TicketRecord.class).config());
    }
}
