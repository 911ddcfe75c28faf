package org.netpreserve.printroo.cdp;

/**
 * Common viewport sizes for {@link ChromeArguments#setWindowSize(WindowSize)}.
 */
public enum WindowSize {
    SVGA(800, 600),
    WSVGA(1024, 600),
    XGA(1024, 768),
    XGAPLUS(1152, 864),
    WXGA_5_3(1280, 768),
    WXGA_16_10(1280, 800),
    SXGA(1280, 1024),
    HD_1360_768(1360, 768),
    HD_1366_768(1366, 768),
    OTHER_1536_864(1536, 864),
    HD_PLUS(1600, 900),
    WSXGA_PLUS(1680, 1050),
    FHD(1920, 1080),
    WUXGA(1920, 1200),
    OTHER_2560_1070(2560, 1070),
    WQHD(2560, 1440),
    OTHER_3440_1440(3440, 1440),
    UHD_4K(3840, 2160);

    private final int width;
    private final int height;

    WindowSize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }
}
