package org.modcat.output.render;

import java.util.Locale;

/**
 * How graph nodes are labeled in the rendered diagram.
 */
public enum LabelMode {
    /** A, B, ..., Z, AA, AB, ... */
    LETTERS,
    /** 1, 2, 3, ... */
    NUMBERS;

    /**
     * Returns the label for the node at the given zero-based position.
     */
    public String label(int index) {
        if (this == NUMBERS) {
            return Integer.toString(index + 1);
        }
        StringBuilder label = new StringBuilder();
        int i = index;
        while (i >= 0) {
            label.insert(0, (char) ('A' + i % 26));
            i = i / 26 - 1;
        }
        return label.toString();
    }

    public static LabelMode fromString(String name) {
        try {
            return valueOf(name.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown label mode '" + name + "', expected letters or numbers", e);
        }
    }
}
