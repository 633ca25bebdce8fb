package org.winslowlab.ultraseq.tools.dualguide;

/**
 * Classification of an extracted read against the guide reference.
 */
public enum ReadClass {
    /** Both guides are in the reference, each at its own position. */
    EXPECTED("Expected"),
    /** At least one guide is not in the reference for its position. */
    UNEXPECTED("Unexpected");

    private final String label;

    ReadClass(final String label) {
        this.label = label;
    }

    /**
     * @return the value written in the {@code Class} column.
     */
    public String getLabel() {
        return label;
    }

    /**
     * @throws IllegalArgumentException if the label is not a known class.
     */
    public static ReadClass fromLabel(final String label) {
        for (final ReadClass readClass : values()) {
            if (readClass.label.equals(label)) {
                return readClass;
            }
        }
        throw new IllegalArgumentException("unknown read class: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
