package org.oldskooler.modelforge.synth;

import org.oldskooler.modelforge.InvalidConstraintException;
import org.oldskooler.modelforge.mapping.ColumnMeta;
import org.oldskooler.modelforge.mapping.MappingRegistry;
import org.oldskooler.modelforge.mapping.TableMeta;
import org.oldskooler.modelforge.model.ModelConfig;
import org.oldskooler.modelforge.model.ValidatedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds a validated model from a record model class, one field per column in declaration order.
 * <p>
 * Synthesis is all-or-nothing: the first column that fails aborts the run and its exception
 * propagates unchanged. Nothing is cached between runs, so two calls for the same class
 * return two unrelated models.
 * </p>
 */
public class ModelSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(ModelSynthesizer.class);

    private final MappingRegistry registry;
    private final FieldSynthesizer fieldSynthesizer;

    public ModelSynthesizer() {
        this(new MappingRegistry(), new FieldSynthesizer());
    }

    public ModelSynthesizer(MappingRegistry registry) {
        this(registry, new FieldSynthesizer());
    }

    public ModelSynthesizer(MappingRegistry registry, FieldSynthesizer fieldSynthesizer) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.fieldSynthesizer = Objects.requireNonNull(fieldSynthesizer, "fieldSynthesizer");
    }

    /**
     * Field specifications of {@code recordType} without building the model.
     *
     * @param config passed through untouched; may be null
     */
    public <T> ModelSpec describe(Class<T> recordType, ModelConfig config) {
        TableMeta<T> meta = TableMeta.of(recordType, registry);
        SynthesisContext context = new SynthesisContext();

        List<FieldSpec> fields = new ArrayList<>(meta.columns.size());
        Map<String, String> externalNames = new HashMap<>();
        for (ColumnMeta column : meta.columns.values()) {
            FieldSpec field = fieldSynthesizer.synthesize(column, context);

            String clash = externalNames.put(field.alias(), field.name());
            if (clash != null) {
                throw new InvalidConstraintException(field.name(), "alias",
                        "name '" + field.alias() + "' is already used by field '" + clash + "'");
            }
            fields.add(field);
        }

        return new ModelSpec(recordType.getSimpleName(), fields, context.definitions(), config);
    }

    public <T> ValidatedModel synthesize(Class<T> recordType, ModelConfig config) {
        ModelSpec spec = describe(recordType, config);
        log.debug("Synthesized model {} with {} field(s) and {} enum definition(s)",
                spec.name(), spec.fields().size(), spec.definitions().size());
        return ValidatedModel.of(spec);
    }

    public <T> ValidatedModel synthesize(Class<T> recordType) {
        return synthesize(recordType, null);
    }
}
