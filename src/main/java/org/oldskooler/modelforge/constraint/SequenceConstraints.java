package org.oldskooler.modelforge.constraint;

/** Size limits of a sequence field. */
public final class SequenceConstraints {
    public static final SequenceConstraints NONE = new SequenceConstraints(null, null);

    private final Integer minItems;
    private final Integer maxItems;

    private SequenceConstraints(Integer minItems, Integer maxItems) {
        this.minItems = minItems;
        this.maxItems = maxItems;
    }

    public static SequenceConstraints of(Integer minItems, Integer maxItems) {
        return (minItems == null && maxItems == null) ? NONE : new SequenceConstraints(minItems, maxItems);
    }

    public Integer getMinItems() { return minItems; }

    public Integer getMaxItems() { return maxItems; }

    public boolean isEmpty() {
        return minItems == null && maxItems == null;
    }

    @Override
    public String toString() {
        return "SequenceConstraints{minItems=" + minItems + ", maxItems=" + maxItems + "}";
    }
}
