package org.netpreserve.printroo;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.netpreserve.printroo.cdp.*;
import org.netpreserve.printroo.cdp.protocol.CDPTimeoutException;
import org.netpreserve.printroo.preprocess.Sanitizer;
import org.netpreserve.printroo.util.Url;

import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ConverterTest {
    private static final byte[] PDF = "%PDF-1.4 test".getBytes(UTF_8);
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};
    private static final byte[] MHTML = "MIME-Version: 1.0".getBytes(UTF_8);

    @TempDir
    Path tempDir;
    private BrowserSupervisor supervisor;
    private BrowserProcess browser;
    private Navigator navigator;
    private NetworkManager networkManager;
    private Converter converter;

    @BeforeEach
    void setUp() {
        supervisor = mock(BrowserSupervisor.class);
        browser = mock(BrowserProcess.class);
        navigator = mock(Navigator.class);
        networkManager = mock(NetworkManager.class);
        when(supervisor.ensureRunning(any())).thenReturn(browser);
        when(browser.newWindow()).thenReturn(navigator);
        when(navigator.networkManager()).thenReturn(networkManager);
        when(navigator.printToPdf(any())).thenReturn(PDF);
        when(navigator.captureScreenshot()).thenReturn(PNG);
        when(navigator.captureSnapshot()).thenReturn(MHTML);
        converter = new Converter(supervisor);
    }

    @Test
    void inlineHtmlIsNeverNavigated() throws Exception {
        var output = new ByteArrayOutputStream();
        converter.convertToPdf("<p>hello</p>", output, PageSettings.defaults(), ConversionOptions.defaults());

        assertArrayEquals(PDF, output.toByteArray());
        verify(navigator).setDocumentContent("<p>hello</p>");
        verify(navigator, never()).navigateTo(any(), any());
        verify(navigator).close();
        verify(browser).setCountdown(null);
        assertEquals(ConversionState.DONE, converter.state());
    }

    @Test
    void urlIsNavigatedWithMediaLoadTimeout() throws Exception {
        var url = new Url("https://example.org/");
        var options = ConversionOptions.builder().mediaLoadTimeout(Duration.ofSeconds(5)).build();
        converter.convertToPdf(url, new ByteArrayOutputStream(), PageSettings.defaults(), options);
        verify(navigator).navigateTo(url, Duration.ofSeconds(5));
    }

    @Test
    void pageSettingsArePassedToPrint() {
        var pageSettings = PageSettings.of(PaperFormat.A4).withLandscape(true).withMargins(0);
        converter.convertToPdf("<p>a4</p>", new ByteArrayOutputStream(), pageSettings, ConversionOptions.defaults());

        var captor = ArgumentCaptor.forClass(PrintOptions.class);
        verify(navigator).printToPdf(captor.capture());
        var printOptions = captor.getValue();
        assertTrue(printOptions.landscape());
        assertEquals(PaperFormat.A4.width(), printOptions.paperWidth());
        assertEquals(0.0, printOptions.marginLeft());
    }

    @Test
    void imageConversionTakesAScreenshot() {
        var output = new ByteArrayOutputStream();
        converter.convertToImage("<p>hello</p>", output, PageSettings.defaults(), ConversionOptions.defaults());
        assertArrayEquals(PNG, output.toByteArray());
        verify(navigator, never()).printToPdf(any());
    }

    @Test
    void snapshotIsTakenBeforeRendering() {
        var snapshot = new ByteArrayOutputStream();
        converter.setSnapshotStream(snapshot);
        var options = ConversionOptions.builder().captureSnapshot(true).build();
        converter.convertToPdf("<p>hello</p>", new ByteArrayOutputStream(), PageSettings.defaults(), options);

        var inOrder = inOrder(navigator);
        inOrder.verify(navigator).captureSnapshot();
        inOrder.verify(navigator).printToPdf(any());
        assertArrayEquals(MHTML, snapshot.toByteArray());
    }

    @Test
    void snapshotWithoutStreamFails() {
        var options = ConversionOptions.builder().captureSnapshot(true).build();
        var output = new ByteArrayOutputStream();
        assertThrows(ConversionException.class, () ->
                converter.convertToPdf("<p>hello</p>", output, PageSettings.defaults(), options));
        assertEquals(0, output.size());
        assertEquals(ConversionState.FAILED, converter.state());
        verify(navigator).close();
    }

    @Test
    void fileConversionWritesSnapshotNextToOutput() throws Exception {
        var options = ConversionOptions.builder().captureSnapshot(true).build();
        Path output = tempDir.resolve("page.pdf");
        converter.convertToPdf("<p>hello</p>", output, PageSettings.defaults(), options);

        assertArrayEquals(PDF, Files.readAllBytes(output));
        assertArrayEquals(MHTML, Files.readAllBytes(tempDir.resolve("page.mhtml")));
    }

    @Test
    void failedFileConversionWritesNothing() throws Exception {
        doThrow(new NavigationFailedException(new Url("https://example.invalid/"), "net::ERR_NAME_NOT_RESOLVED"))
                .when(navigator).navigateTo(any(), any());
        Path output = tempDir.resolve("page.pdf");
        var e = assertThrows(ConversionException.class, () -> converter.convertToPdf(
                new Url("https://example.invalid/"), output, PageSettings.defaults(), ConversionOptions.defaults()));
        assertInstanceOf(NavigationFailedException.class, e.getCause());
        assertFalse(Files.exists(output));
        verify(navigator).close();
    }

    @Test
    void missingOutputDirectory() {
        assertThrows(ConfigurationException.class, () -> converter.convertToPdf("<p>hello</p>",
                tempDir.resolve("missing/page.pdf"), PageSettings.defaults(), ConversionOptions.defaults()));
        verifyNoInteractions(supervisor);
    }

    @Test
    void timeoutMustBePositive() {
        var options = ConversionOptions.builder().timeout(Duration.ZERO).build();
        assertThrows(ConfigurationException.class, () -> converter.convertToPdf("<p>hello</p>",
                new ByteArrayOutputStream(), PageSettings.defaults(), options));
        verifyNoInteractions(supervisor);
    }

    @Test
    void oneMillisecondTimeoutFailsBeforeRendering() throws Exception {
        doAnswer(invocation -> {
            Thread.sleep(5);
            throw new CDPTimeoutException("No time left to send Page.navigate");
        }).when(navigator).navigateTo(any(), any());
        var options = ConversionOptions.builder().timeout(Duration.ofMillis(1)).build();

        for (var format : List.of("pdf", "png")) {
            var output = new ByteArrayOutputStream();
            var url = new Url("https://example.org/");
            var e = assertThrows(ConversionTimeoutException.class, () -> {
                if (format.equals("pdf")) {
                    converter.convertToPdf(url, output, PageSettings.defaults(), options);
                } else {
                    converter.convertToImage(url, output, PageSettings.defaults(), options);
                }
            });
            assertTrue(e.getMessage().contains("1 milliseconds"), e.getMessage());
            assertEquals(0, output.size());
        }
        verify(navigator, never()).printToPdf(any());
        verify(navigator, never()).captureScreenshot();
        assertEquals(ConversionState.FAILED, converter.state());
    }

    @Test
    void expiredCountdownIsReportedAsTimeout() throws Exception {
        doAnswer(invocation -> {
            Thread.sleep(200);
            throw new CDPTimeoutException("Timed out waiting for Page.loadEventFired");
        }).when(navigator).navigateTo(any(), any());
        var options = ConversionOptions.builder().timeout(Duration.ofMillis(50)).build();

        var e = assertThrows(ConversionTimeoutException.class, () -> converter.convertToPdf(
                new Url("https://example.org/"), new ByteArrayOutputStream(), PageSettings.defaults(), options));
        assertInstanceOf(CDPTimeoutException.class, e.getCause());
        assertTrue(e.getMessage().contains("50 milliseconds"), e.getMessage());
        verify(supervisor).ensureRunning(argThat(countdown -> countdown != null &&
                                                              countdown.budget().equals(Duration.ofMillis(50))));
    }

    @Test
    void windowStatusAndScript() throws Exception {
        var options = ConversionOptions.builder()
                .windowStatus("ready", Duration.ofSeconds(5))
                .runJavascript("document.body.style.color = 'red'")
                .build();
        converter.convertToPdf("<p>hello</p>", new ByteArrayOutputStream(), PageSettings.defaults(), options);

        var inOrder = inOrder(navigator);
        inOrder.verify(navigator).waitForWindowStatus(eq("ready"), eq(Duration.ofSeconds(5)), any());
        inOrder.verify(navigator).runJavascript("document.body.style.color = 'red'");
        inOrder.verify(navigator).printToPdf(any());
    }

    @Test
    void networkSetup() {
        var options = ConversionOptions.builder().urlBlacklist(List.of("*.png")).logNetworkTraffic(true).build();
        converter.convertToPdf("<p>hello</p>", new ByteArrayOutputStream(), PageSettings.defaults(), options);

        verify(networkManager).setCacheDisabled(true);
        verify(networkManager).logTraffic(true);
        verify(networkManager).block(argThat(blacklist -> blacklist.patterns().equals(List.of("*.png"))),
                eq(Set.of()));
    }

    @Test
    void diskCacheKeepsCacheEnabled() {
        converter.setDiskCache(tempDir, 10L);
        converter.convertToPdf("<p>hello</p>", new ByteArrayOutputStream(), PageSettings.defaults(),
                ConversionOptions.defaults());
        verify(networkManager).setCacheDisabled(false);
    }

    @Test
    void textFilesArePreWrapped() throws Exception {
        Path input = Files.writeString(tempDir.resolve("notes.txt"), "a < b & c");
        Path work = tempDir.resolve("work");
        var options = ConversionOptions.builder()
                .preWrapExtensions(List.of(".TXT"))
                .urlBlacklist(List.of("file:*"))
                .tempDirectory(work)
                .build();
        var navigated = ArgumentCaptor.forClass(Url.class);
        doAnswer(invocation -> {
            Url url = invocation.getArgument(0);
            assertTrue(Files.readString(url.toPath()).contains("a &lt; b &amp; c"));
            return null;
        }).when(navigator).navigateTo(navigated.capture(), any());

        converter.convertToPdf(Url.of(input), new ByteArrayOutputStream(), PageSettings.defaults(), options);

        Url wrapped = navigated.getValue();
        assertTrue(wrapped.toString().endsWith("/notes.txt.html"), wrapped.toString());
        verify(networkManager).block(any(), eq(Set.of(wrapped)));
        try (var remaining = Files.list(work)) {
            assertEquals(0, remaining.count());
        }
    }

    @Test
    void tempDirectoryCanBeKept() throws Exception {
        Path input = Files.writeString(tempDir.resolve("notes.txt"), "text");
        Path work = tempDir.resolve("work");
        var options = ConversionOptions.builder()
                .preWrapExtensions(List.of(".txt"))
                .tempDirectory(work)
                .keepTempDirectory(true)
                .build();
        converter.convertToPdf(Url.of(input), new ByteArrayOutputStream(), PageSettings.defaults(), options);
        try (var remaining = Files.list(work)) {
            assertEquals(1, remaining.count());
        }
    }

    @Test
    void sanitizedPageIsRenderedAndAllowed() throws Exception {
        Path input = Files.writeString(tempDir.resolve("page.html"), "<script>alert(1)</script>");
        var sanitized = new Url("file:///tmp/sanitized.html");
        Sanitizer sanitizer = (url, directory) -> sanitized;
        converter.setSanitizer(sanitizer);
        var options = ConversionOptions.builder().sanitizeHtml(true).build();

        converter.convertToPdf(Url.of(input), new ByteArrayOutputStream(), PageSettings.defaults(), options);

        verify(navigator).navigateTo(sanitized, null);
        verify(networkManager).block(any(), eq(Set.of(sanitized)));
    }

    @Test
    void sanitizingWithoutSanitizerIsAConfigurationError() throws Exception {
        Path input = Files.writeString(tempDir.resolve("page.html"), "<p>hi</p>");
        var options = ConversionOptions.builder().sanitizeHtml(true).build();
        assertThrows(ConfigurationException.class, () -> converter.convertToPdf(Url.of(input),
                new ByteArrayOutputStream(), PageSettings.defaults(), options));
        verifyNoInteractions(supervisor);
    }

    @Test
    void localFilesAreValidated() throws Exception {
        Path binary = Files.write(tempDir.resolve("program.exe"), new byte[]{0});
        var e = assertThrows(ConversionException.class, () -> converter.convertToPdf(Url.of(binary),
                new ByteArrayOutputStream(), PageSettings.defaults(), ConversionOptions.defaults()));
        assertTrue(e.getMessage().contains("preWrapExtensions"), e.getMessage());

        assertThrows(ConversionException.class, () -> converter.convertToPdf(Url.of(tempDir.resolve("gone.html")),
                new ByteArrayOutputStream(), PageSettings.defaults(), ConversionOptions.defaults()));
        verifyNoInteractions(supervisor);
    }

    @Test
    void browserOptionsAreDelegated() {
        var realConverter = new Converter(new BrowserSupervisor(new ChromeArguments()));
        realConverter.addChromeArgument("--lang", "nl");
        realConverter.setWindowSize(WindowSize.XGA);
        realConverter.removeChromeArgument("--mute-audio");
        var arguments = realConverter.chromeArguments();
        assertTrue(arguments.contains("--lang=nl"));
        assertTrue(arguments.contains("--window-size=1024,768"));
        assertFalse(arguments.contains("--mute-audio"));
        assertThrows(ConfigurationException.class, () -> realConverter.removeChromeArgument("--headless"));

        realConverter.resetChromeArguments();
        assertFalse(realConverter.chromeArguments().contains("--lang=nl"));
        realConverter.close();
    }

    @Test
    void closeStopsTheBrowser() {
        converter.close();
        verify(supervisor).close();
    }
}
