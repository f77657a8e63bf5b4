package org.oldskooler.modelforge.constraint;

/** Bounds of an integer or number field. Unset bounds are null. */
public final class NumericConstraints {
    public static final NumericConstraints NONE = new NumericConstraints(null, null, null, null, null);

    private final Number ge;
    private final Number gt;
    private final Number le;
    private final Number lt;
    private final Number multipleOf;

    private NumericConstraints(Number ge, Number gt, Number le, Number lt, Number multipleOf) {
        this.ge = ge;
        this.gt = gt;
        this.le = le;
        this.lt = lt;
        this.multipleOf = multipleOf;
    }

    public Number getGe() { return ge; }

    public Number getGt() { return gt; }

    public Number getLe() { return le; }

    public Number getLt() { return lt; }

    public Number getMultipleOf() { return multipleOf; }

    public boolean isEmpty() {
        return ge == null && gt == null && le == null && lt == null && multipleOf == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "NumericConstraints{ge=" + ge + ", gt=" + gt + ", le=" + le + ", lt=" + lt + ", multipleOf=" + multipleOf + "}";
    }

    public static class Builder {
        private Number ge;
        private Number gt;
        private Number le;
        private Number lt;
        private Number multipleOf;

        public Builder ge(Number ge) { this.ge = ge; return this; }

        public Builder gt(Number gt) { this.gt = gt; return this; }

        public Builder le(Number le) { this.le = le; return this; }

        public Builder lt(Number lt) { this.lt = lt; return this; }

        public Builder multipleOf(Number multipleOf) { this.multipleOf = multipleOf; return this; }

        public NumericConstraints build() {
            NumericConstraints c = new NumericConstraints(ge, gt, le, lt, multipleOf);
            return c.isEmpty() ? NONE : c;
        }
    }
}
