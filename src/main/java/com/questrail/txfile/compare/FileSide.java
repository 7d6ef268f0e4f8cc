package com.questrail.txfile.compare;

/**
 * Which of the two compared record sets a record belongs to.
 */
public enum FileSide
{
    FIRST("#1"),
    SECOND("#2");

    private final String label;

    FileSide(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public FileSide other() {
        return this == FIRST ? SECOND : FIRST;
    }
}
