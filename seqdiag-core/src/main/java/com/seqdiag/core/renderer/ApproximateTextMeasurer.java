package com.seqdiag.core.renderer;

import com.seqdiag.core.geometry.Size;

/**
 * {@link TextMeasurer} estimating widths from an average glyph width.
 *
 * <p>Good enough for layout when no font metrics are available (e.g. SVG rendered by a browser
 * later). Heights are the font size times the line height factor.
 */
public class ApproximateTextMeasurer implements TextMeasurer {

    private static final double LINE_HEIGHT = 1.2;

    private final double charWidthRatio;

    /**
     * @param charWidthRatio average glyph width as a fraction of the font size
     */
    public ApproximateTextMeasurer(double charWidthRatio) {
        if (charWidthRatio <= 0) {
            throw new IllegalArgumentException("charWidthRatio must be positive: " + charWidthRatio);
        }
        this.charWidthRatio = charWidthRatio;
    }

    @Override
    public Size measure(String text, String fontFamily, double fontSize) {
        int length = text.codePointCount(0, text.length());
        return new Size(length * fontSize * charWidthRatio, fontSize * LINE_HEIGHT);
    }
}
