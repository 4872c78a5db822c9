package com.seqdiag.core.renderer;

import com.seqdiag.core.geometry.Size;

import java.util.Objects;

/**
 * Attributes shared by all parts during measurement and drawing.
 *
 * @param fontFamily font family used for all text
 * @param fontSize font size in pixels
 * @param textMeasurer measurement service for text
 */
public record RenderAttributes(
    String fontFamily,
    double fontSize,
    TextMeasurer textMeasurer
) {
    /**
     * Compact constructor with validation.
     */
    public RenderAttributes {
        Objects.requireNonNull(fontFamily, "fontFamily must not be null");
        Objects.requireNonNull(textMeasurer, "textMeasurer must not be null");
        if (fontSize <= 0) {
            throw new IllegalArgumentException("fontSize must be positive: " + fontSize);
        }
    }

    /**
     * Measures text with these attributes.
     *
     * @param text the text
     * @return bounding box of the text
     */
    public Size measureText(String text) {
        return textMeasurer.measure(text, fontFamily, fontSize);
    }
}
