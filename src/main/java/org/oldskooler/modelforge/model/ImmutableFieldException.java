package org.oldskooler.modelforge.model;

/** Assignment to an immutable model, or to a field declared with {@code allow_mutation: false}. */
public class ImmutableFieldException extends RuntimeException {
    public ImmutableFieldException(String message) {
        super(message);
    }
}
