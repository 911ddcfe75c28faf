package org.netpreserve.printroo;

import org.netpreserve.printroo.cdp.PrintOptions;

/**
 * Layout of the rendered PDF. Sizes are in inches. Fields left null take the browser's defaults.
 *
 * @param paperFormat       named paper size, overridden by paperWidth and paperHeight when those are set
 * @param printBackground   print background graphics, i.e. colour instead of grayscale
 * @param pageRanges        pages to print, e.g. {@code 1-5, 8, 11-13}
 * @param preferCSSPageSize let a CSS {@code @page} size rule win over the paper size
 */
public record PageSettings(
        PaperFormat paperFormat,
        Double paperWidth,
        Double paperHeight,
        Boolean landscape,
        Double marginTop,
        Double marginBottom,
        Double marginLeft,
        Double marginRight,
        Double scale,
        Boolean printBackground,
        Boolean displayHeaderFooter,
        String headerTemplate,
        String footerTemplate,
        String pageRanges,
        Boolean preferCSSPageSize) {
    private static final double DEFAULT_MARGIN = 0.4;

    public PageSettings {
        if (paperFormat == null) paperFormat = PaperFormat.LETTER;
        if (paperWidth == null) paperWidth = paperFormat.width();
        if (paperHeight == null) paperHeight = paperFormat.height();
        if (landscape == null) landscape = false;
        if (marginTop == null) marginTop = DEFAULT_MARGIN;
        if (marginBottom == null) marginBottom = DEFAULT_MARGIN;
        if (marginLeft == null) marginLeft = DEFAULT_MARGIN;
        if (marginRight == null) marginRight = DEFAULT_MARGIN;
        if (scale == null) scale = 1.0;
        if (printBackground == null) printBackground = false;
        if (displayHeaderFooter == null) displayHeaderFooter = false;
        if (preferCSSPageSize == null) preferCSSPageSize = false;
        if (paperWidth <= 0 || paperHeight <= 0) {
            throw new ConfigurationException("Paper size must be positive: " + paperWidth + "x" + paperHeight);
        }
        if (scale < 0.1 || scale > 2) {
            throw new ConfigurationException("Scale must be between 0.1 and 2: " + scale);
        }
    }

    public static PageSettings defaults() {
        return of(PaperFormat.LETTER);
    }

    public static PageSettings of(PaperFormat paperFormat) {
        return new PageSettings(paperFormat, null, null, null, null, null, null, null, null, null, null, null,
                null, null, null);
    }

    public PageSettings withLandscape(boolean landscape) {
        return new PageSettings(paperFormat, paperWidth, paperHeight, landscape, marginTop, marginBottom, marginLeft,
                marginRight, scale, printBackground, displayHeaderFooter, headerTemplate, footerTemplate, pageRanges,
                preferCSSPageSize);
    }

    public PageSettings withMargins(double margin) {
        return new PageSettings(paperFormat, paperWidth, paperHeight, landscape, margin, margin, margin, margin,
                scale, printBackground, displayHeaderFooter, headerTemplate, footerTemplate, pageRanges,
                preferCSSPageSize);
    }

    /**
     * Width of the area between the left and right margins.
     */
    public double printableWidth() {
        double width = landscape ? paperHeight : paperWidth;
        return width - marginLeft - marginRight;
    }

    public PrintOptions toPrintOptions() {
        return new PrintOptions(landscape, displayHeaderFooter, printBackground, scale, paperWidth, paperHeight,
                marginTop, marginBottom, marginLeft, marginRight, pageRanges, headerTemplate, footerTemplate,
                preferCSSPageSize || paperFormat == PaperFormat.FIT_PAGE_TO_CONTENT);
    }
}
