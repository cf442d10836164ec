package org.manuscript.scope;

/**
 * Definedness lattice, ordered from least to most certain. Joining two states keeps
 * the more certain one.
 */
public enum Definedness {
    UNDEFINED,
    POSSIBLY_DEFINED,
    DEFINED;

    public Definedness join(Definedness other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
