package org.oldskooler.modelforge.constraint;

import java.util.regex.Pattern;

/** Length and pattern limits of a string field. */
public final class StringConstraints {
    public static final StringConstraints NONE = new StringConstraints(null, null, null);

    private final Integer minLength;
    private final Integer maxLength;
    private final Pattern regex;

    private StringConstraints(Integer minLength, Integer maxLength, Pattern regex) {
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.regex = regex;
    }

    public Integer getMinLength() { return minLength; }

    public Integer getMaxLength() { return maxLength; }

    /** Compiled pattern; values must match from their first character. */
    public Pattern getRegex() { return regex; }

    public boolean isEmpty() {
        return minLength == null && maxLength == null && regex == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "StringConstraints{minLength=" + minLength + ", maxLength=" + maxLength
                + ", regex=" + (regex == null ? null : regex.pattern()) + "}";
    }

    public static class Builder {
        private Integer minLength;
        private Integer maxLength;
        private Pattern regex;

        public Builder minLength(Integer minLength) { this.minLength = minLength; return this; }

        public Builder maxLength(Integer maxLength) { this.maxLength = maxLength; return this; }

        public Builder regex(Pattern regex) { this.regex = regex; return this; }

        public StringConstraints build() {
            StringConstraints c = new StringConstraints(minLength, maxLength, regex);
            return c.isEmpty() ? NONE : c;
        }
    }
}
