package org.oldskooler.modelforge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One failed check: where (field name, then item indexes), what, and a stable error type
 * such as {@code value_error.number.not_ge}.
 */
public final class ValidationError {
    private final List<Object> loc;
    private final String message;
    private final String type;

    public ValidationError(List<Object> loc, String message, String type) {
        this.loc = Collections.unmodifiableList(new ArrayList<>(loc));
        this.message = Objects.requireNonNull(message, "message");
        this.type = Objects.requireNonNull(type, "type");
    }

    public List<Object> getLoc() {
        return loc;
    }

    public String getMessage() {
        return message;
    }

    public String getType() {
        return type;
    }

    /** {@code tags -> 1} */
    public String locString() {
        StringBuilder b = new StringBuilder();
        for (Object part : loc) {
            if (b.length() > 0) b.append(" -> ");
            b.append(part);
        }
        return b.toString();
    }

    @Override
    public String toString() {
        return locString() + "\n  " + message + " (type=" + type + ")";
    }
}
