package com.regesh.model;

/**
 * Length limits applied to record text.
 */
public final class Texts {

    private Texts() {
    }

    /**
     * Cuts {@code value} to at most {@code maxLength} chars.  A surrogate pair is never split:
     * when the cut would fall between its two halves, the whole pair is dropped.
     */
    public static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
