package org.oldskooler.modelforge.model;

/**
 * Model-level behavior of a validated model.
 * The synthesizer attaches it as given; only the model runtime reads it.
 */
public class ModelConfig {

    /** Defaults: no assignment validation, mutable, extra keys ignored, lookup by external name only. */
    public static final ModelConfig DEFAULT = builder().build();

    private final boolean validateAssignment;
    private final boolean allowMutation;
    private final Extra extra;
    private final boolean populateByName;
    private final String title;

    /**
     * Creates model options with specified settings.
     *
     * @param validateAssignment whether {@link ModelInstance#set} validates the new value
     * @param allowMutation whether instances accept assignment at all
     * @param extra handling of unknown input keys
     * @param populateByName whether aliased fields also accept their internal name
     * @param title schema title, or null to use the model name
     */
    public ModelConfig(boolean validateAssignment,
                       boolean allowMutation,
                       Extra extra,
                       boolean populateByName,
                       String title) {
        this.validateAssignment = validateAssignment;
        this.allowMutation = allowMutation;
        this.extra = extra == null ? Extra.IGNORE : extra;
        this.populateByName = populateByName;
        this.title = title;
    }

    public boolean isValidateAssignment() {
        return validateAssignment;
    }

    public boolean isAllowMutation() {
        return allowMutation;
    }

    public Extra getExtra() {
        return extra;
    }

    public boolean isPopulateByName() {
        return populateByName;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Creates a builder for constructing ModelConfig.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ModelConfig{validateAssignment=" + validateAssignment
                + ", allowMutation=" + allowMutation
                + ", extra=" + extra
                + ", populateByName=" + populateByName
                + (title == null ? "" : ", title=" + title)
                + "}";
    }

    /**
     * Builder for ModelConfig.
     */
    public static class Builder {
        private boolean validateAssignment = false;
        private boolean allowMutation = true;
        private Extra extra = Extra.IGNORE;
        private boolean populateByName = false;
        private String title = null;

        public Builder validateAssignment(boolean validateAssignment) {
            this.validateAssignment = validateAssignment;
            return this;
        }

        public Builder allowMutation(boolean allowMutation) {
            this.allowMutation = allowMutation;
            return this;
        }

        public Builder extra(Extra extra) {
            this.extra = extra;
            return this;
        }

        public Builder populateByName(boolean populateByName) {
            this.populateByName = populateByName;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public ModelConfig build() {
            return new ModelConfig(validateAssignment, allowMutation, extra, populateByName, title);
        }
    }
}
