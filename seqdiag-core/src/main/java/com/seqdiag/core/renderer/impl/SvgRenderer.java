package com.seqdiag.core.renderer.impl;

import com.seqdiag.core.geometry.Point;
import com.seqdiag.core.geometry.Size;
import com.seqdiag.core.renderer.LineStyle;
import com.seqdiag.core.renderer.RenderAttributes;
import com.seqdiag.core.renderer.Renderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * {@link Renderer} producing a standalone SVG document.
 *
 * <p>Primitives are collected as SVG elements; {@link #toSvg(Size)} wraps them in an
 * {@code <svg>} root sized to the diagram.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * SvgRenderer renderer = new SvgRenderer();
 * diagram.layout(attributes);
 * diagram.draw(renderer);
 * String svg = renderer.toSvg(diagram.getComputedSize());
 * }</pre>
 */
public class SvgRenderer implements Renderer {

    private static final Logger log = LoggerFactory.getLogger(SvgRenderer.class);

    private static final String SVG_NAMESPACE = "http://www.w3.org/2000/svg";
    private static final String STROKE = "stroke=\"#000000\" stroke-width=\"1\"";
    private static final String DASH_PATTERN = " stroke-dasharray=\"4 4\"";

    private final StringBuilder elements = new StringBuilder();
    private int elementCount;

    @Override
    public void drawLine(Point from, Point to, LineStyle style) {
        append("<line x1=\"" + num(from.x()) + "\" y1=\"" + num(from.y())
            + "\" x2=\"" + num(to.x()) + "\" y2=\"" + num(to.y()) + "\" " + STROKE
            + (style == LineStyle.DASHED ? DASH_PATTERN : "") + "/>");
    }

    @Override
    public void drawRect(Point topLeft, Size size) {
        append("<rect x=\"" + num(topLeft.x()) + "\" y=\"" + num(topLeft.y())
            + "\" width=\"" + num(size.width()) + "\" height=\"" + num(size.height())
            + "\" fill=\"#ffffff\" " + STROKE + "/>");
    }

    @Override
    public void drawCircle(Point center, double radius) {
        append("<circle cx=\"" + num(center.x()) + "\" cy=\"" + num(center.y())
            + "\" r=\"" + num(radius) + "\" fill=\"#ffffff\" " + STROKE + "/>");
    }

    @Override
    public void drawText(String text, Point topCenter, RenderAttributes attributes) {
        append("<text x=\"" + num(topCenter.x()) + "\" y=\"" + num(topCenter.y())
            + "\" font-family=\"" + escape(attributes.fontFamily())
            + "\" font-size=\"" + num(attributes.fontSize())
            + "\" text-anchor=\"middle\" dominant-baseline=\"hanging\">" + escape(text) + "</text>");
    }

    /**
     * Produces the SVG document for everything drawn so far.
     *
     * @param size document size
     * @return SVG markup
     */
    public String toSvg(Size size) {
        log.debug("Writing SVG document with {} elements ({}x{})", elementCount, size.width(), size.height());
        return "<svg xmlns=\"" + SVG_NAMESPACE + "\" width=\"" + num(size.width())
            + "\" height=\"" + num(size.height()) + "\" viewBox=\"0 0 " + num(size.width())
            + " " + num(size.height()) + "\">\n" + elements + "</svg>\n";
    }

    private void append(String element) {
        elements.append("  ").append(element).append('\n');
        elementCount++;
    }

    private static String num(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&apos;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
