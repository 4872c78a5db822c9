package com.seqdiag.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.seqdiag.core.renderer.ApproximateTextMeasurer;
import com.seqdiag.core.renderer.RenderAttributes;

/**
 * Settings controlling diagram layout and text rendering.
 *
 * <p>Loaded from {@code seqdiag.yaml}. Missing or invalid values fall back to the defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * entitySpacing: 40
 * placeholderHeight: 200
 * font:
 *   family: "sans-serif"
 *   size: 14
 *   charWidthRatio: 0.6
 * }</pre>
 *
 * @param entitySpacing horizontal gap between neighbouring entity heads
 * @param placeholderHeight diagram height used until a vertical layout exists
 * @param font text settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiagramConfig(
    @JsonProperty("entitySpacing") Double entitySpacing,
    @JsonProperty("placeholderHeight") Double placeholderHeight,
    @JsonProperty("font") FontConfig font
) {
    public static final double DEFAULT_ENTITY_SPACING = 40;
    public static final double DEFAULT_PLACEHOLDER_HEIGHT = 200;

    /**
     * Compact constructor applying defaults.
     */
    public DiagramConfig {
        if (entitySpacing == null || !Double.isFinite(entitySpacing) || entitySpacing < 0) {
            entitySpacing = DEFAULT_ENTITY_SPACING;
        }
        if (placeholderHeight == null || !Double.isFinite(placeholderHeight) || placeholderHeight <= 0) {
            placeholderHeight = DEFAULT_PLACEHOLDER_HEIGHT;
        }
        if (font == null) {
            font = FontConfig.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default diagram config
     */
    public static DiagramConfig defaults() {
        return new DiagramConfig(null, null, null);
    }

    /**
     * Builds the render attributes described by the font settings.
     *
     * @return render attributes with an approximate text measurer
     */
    public RenderAttributes toRenderAttributes() {
        return new RenderAttributes(font.family(), font.size(), new ApproximateTextMeasurer(font.charWidthRatio()));
    }

    /**
     * Font settings.
     *
     * @param family font family
     * @param size font size in pixels
     * @param charWidthRatio average glyph width relative to the font size
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FontConfig(
        @JsonProperty("family") String family,
        @JsonProperty("size") Double size,
        @JsonProperty("charWidthRatio") Double charWidthRatio
    ) {
        public static final String DEFAULT_FAMILY = "sans-serif";
        public static final double DEFAULT_SIZE = 14;
        public static final double DEFAULT_CHAR_WIDTH_RATIO = 0.6;

        public FontConfig {
            if (family == null || family.isBlank()) {
                family = DEFAULT_FAMILY;
            }
            if (size == null || !Double.isFinite(size) || size <= 0) {
                size = DEFAULT_SIZE;
            }
            if (charWidthRatio == null || !Double.isFinite(charWidthRatio) || charWidthRatio <= 0) {
                charWidthRatio = DEFAULT_CHAR_WIDTH_RATIO;
            }
        }

        public static FontConfig defaults() {
            return new FontConfig(null, null, null);
        }
    }
}
