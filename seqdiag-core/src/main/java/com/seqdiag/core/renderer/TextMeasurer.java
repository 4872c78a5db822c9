package com.seqdiag.core.renderer;

import com.seqdiag.core.geometry.Size;

/**
 * Service measuring the space a piece of text occupies when rendered.
 */
@FunctionalInterface
public interface TextMeasurer {

    /**
     * Measures a single line of text.
     *
     * @param text the text
     * @param fontFamily font family name
     * @param fontSize font size in pixels
     * @return the bounding box of the rendered text
     */
    Size measure(String text, String fontFamily, double fontSize);
}
