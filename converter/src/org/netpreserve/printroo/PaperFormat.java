package org.netpreserve.printroo;

/**
 * Standard paper sizes in inches, portrait orientation.
 */
public enum PaperFormat {
    LETTER(8.5, 11),
    LEGAL(8.5, 14),
    TABLOID(11, 17),
    LEDGER(17, 11),
    A0(33.1, 46.8),
    A1(23.4, 33.1),
    A2(16.54, 23.4),
    A3(11.7, 16.54),
    A4(8.27, 11.7),
    A5(5.83, 8.27),
    A6(4.13, 5.83),
    /**
     * The page is sized by the document itself, see
     * {@link org.netpreserve.printroo.preprocess.ContentFitTransformer}. Letter is the fallback.
     */
    FIT_PAGE_TO_CONTENT(8.5, 11);

    private final double width;
    private final double height;

    PaperFormat(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }
}
