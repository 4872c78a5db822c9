package com.seqdiag.core.renderer;

/**
 * Stroke patterns supported by {@link Renderer#drawLine}.
 */
public enum LineStyle {
    SOLID,
    DASHED
}
