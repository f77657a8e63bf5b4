package org.oldskooler.modelforge.models;

public enum Priority {
    LOW, NORMAL, HIGH
}
