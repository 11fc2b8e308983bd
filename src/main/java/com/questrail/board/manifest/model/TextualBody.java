package com.questrail.board.manifest.model;

import java.util.Objects;

/**
 * A body carrying inline text.
 *
 * @param value  the text, possibly empty
 * @param format media type of the text
 */
public record TextualBody(String value, String format) implements AnnotationBody
{
    public static final String TYPE = "TextualBody";
    public static final String PLAIN_TEXT = "text/plain";

    public TextualBody {
        Objects.requireNonNull(value, "value");
        format = format == null ? PLAIN_TEXT : format;
    }

    public static TextualBody plain(String value) {
        return new TextualBody(value, PLAIN_TEXT);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
