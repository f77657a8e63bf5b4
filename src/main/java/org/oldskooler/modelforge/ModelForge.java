package org.oldskooler.modelforge;

import org.oldskooler.modelforge.mapping.EntityMapping;
import org.oldskooler.modelforge.mapping.MappingRegistry;
import org.oldskooler.modelforge.model.ModelConfig;
import org.oldskooler.modelforge.model.ValidatedModel;
import org.oldskooler.modelforge.synth.ModelSynthesizer;

import java.util.Objects;

/**
 * Entry point: derives a {@link ValidatedModel} from a record model class.
 * <p>
 * The static methods read annotations only. An instance carries a {@link MappingRegistry} whose
 * fluent mappings take precedence over annotations for the types registered in it.
 * </p>
 *
 * <pre>{@code
 * ValidatedModel person = ModelForge.modelFrom(PersonRecord.class);
 * ModelInstance p = person.create(Map.of("id", 1, "name", "Someone"));
 * }</pre>
 */
public class ModelForge {
    private static final ModelSynthesizer ANNOTATIONS_ONLY = new ModelSynthesizer();

    /** Registry for fluent record model mappings */
    private final MappingRegistry mappingRegistry;
    private final ModelSynthesizer synthesizer;

    public ModelForge() {
        this(new MappingRegistry());
    }

    public ModelForge(MappingRegistry mappingRegistry) {
        this.mappingRegistry = Objects.requireNonNull(mappingRegistry, "mappingRegistry");
        this.synthesizer = new ModelSynthesizer(mappingRegistry);
    }

    public static ValidatedModel modelFrom(Class<?> recordType) {
        return ANNOTATIONS_ONLY.synthesize(recordType);
    }

    /**
     * @param config attached to the model as is; null for the defaults
     */
    public static ValidatedModel modelFrom(Class<?> recordType, ModelConfig config) {
        return ANNOTATIONS_ONLY.synthesize(recordType, config);
    }

    public <T> ModelForge map(EntityMapping<T> mapping) {
        mappingRegistry.register(mapping);
        return this;
    }

    public ValidatedModel model(Class<?> recordType) {
        return synthesizer.synthesize(recordType);
    }

    public ValidatedModel model(Class<?> recordType, ModelConfig config) {
        return synthesizer.synthesize(recordType, config);
    }

    public MappingRegistry mappingRegistry() {
        return mappingRegistry;
    }
}
