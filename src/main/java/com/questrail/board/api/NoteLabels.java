package com.questrail.board.api;

/**
 * Derives the display label of a note from its text.
 */
public final class NoteLabels
{
    /** Maximum number of characters of note text shown as its label. */
    public static final int MAX_LABEL_LENGTH = 50;

    private NoteLabels() {}

    public static String labelFor(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= MAX_LABEL_LENGTH) {
            return text;
        }
        int end = MAX_LABEL_LENGTH;
        // Keep surrogate pairs together.
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
