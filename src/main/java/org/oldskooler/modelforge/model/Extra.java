package org.oldskooler.modelforge.model;

/**
 * What construction does with input keys that match no field.
 */
public enum Extra {
    /** Drop them silently. */
    IGNORE,
    /** Fail validation with one error per unknown key. */
    FORBID,
    /** Keep them on the instance next to the declared fields. */
    ALLOW
}
