package org.netpreserve.printroo.cdp;

/**
 * Parameters of {@code Page.printToPDF}. Paper dimensions and margins are in inches.
 *
 * @param printBackground  print background graphics, i.e. colour rather than grayscale output
 * @param pageRanges       e.g. {@code 1-5, 8, 11-13}; null or empty for all pages
 * @param headerTemplate   HTML template for the print header, used if displayHeaderFooter is set
 * @param footerTemplate   HTML template for the print footer, used if displayHeaderFooter is set
 */
public record PrintOptions(
        boolean landscape,
        boolean displayHeaderFooter,
        boolean printBackground,
        double scale,
        double paperWidth,
        double paperHeight,
        double marginTop,
        double marginBottom,
        double marginLeft,
        double marginRight,
        String pageRanges,
        String headerTemplate,
        String footerTemplate,
        boolean preferCSSPageSize) {

    public PrintOptions {
        if (scale < 0.1 || scale > 2) {
            throw new IllegalArgumentException("scale must be between 0.1 and 2: " + scale);
        }
        if (paperWidth <= 0 || paperHeight <= 0) {
            throw new IllegalArgumentException("paper dimensions must be positive: " + paperWidth + "x" + paperHeight);
        }
    }

    /**
     * Browser defaults: US Letter portrait with 0.4 inch margins.
     */
    public static PrintOptions defaults() {
        return new PrintOptions(false, false, false, 1.0, 8.5, 11, 0.4, 0.4, 0.4, 0.4,
                null, null, null, false);
    }
}
