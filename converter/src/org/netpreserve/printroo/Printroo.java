package org.netpreserve.printroo;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import org.netpreserve.printroo.cdp.protocol.CDPBase;
import org.netpreserve.printroo.config.ConverterConfig;
import org.netpreserve.printroo.util.Url;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Command-line entry point.
 */
public class Printroo {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(Printroo.class);

    public static void main(String[] args) throws Exception {
        Path configFile = null;
        boolean dumpConfig = false;
        boolean image = false;
        Duration timeout = null;
        PaperFormat paperFormat = null;
        Boolean landscape = null;
        var blacklist = new ArrayList<String>();
        var positional = new ArrayList<String>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--blacklist", "-b" -> blacklist.add(args[++i]);
                case "--config", "-c" -> configFile = Path.of(args[++i]);
                case "--dump-config" -> dumpConfig = true;
                case "--image" -> image = true;
                case "--landscape" -> landscape = true;
                case "--paper" -> paperFormat = PaperFormat.valueOf(args[++i].toUpperCase(Locale.ROOT));
                case "--timeout", "-t" -> timeout = Duration.ofMillis(Long.parseLong(args[++i]));
                case "--trace-cdp" -> startCdpTraceFile(args[++i]);
                case "--help", "-h" -> {
                    System.out.println("Usage: printroo [options] (URL|FILE|-) OUTPUT");
                    System.out.println("Renders a web page, a local file or HTML read from stdin to PDF (default) or PNG.");
                    System.out.println("Options:");
                    System.out.println("  -b, --blacklist PATTERN  Don't load URLs matching PATTERN (* is a wildcard)");
                    System.out.println("  -c, --config FILE        Read configuration from a YAML file");
                    System.out.println("      --dump-config        Print the effective configuration and exit");
                    System.out.println("  -h, --help");
                    System.out.println("      --image              Render a PNG screenshot instead of a PDF");
                    System.out.println("      --landscape          Landscape orientation");
                    System.out.println("      --paper FORMAT       Paper format, e.g. A4 or LETTER");
                    System.out.println("  -t, --timeout MS         Conversion timeout in milliseconds");
                    System.out.println("      --trace-cdp FILE     Write CDP trace to file");
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-") && !args[i].equals("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    positional.add(args[i]);
                }
            }
        }

        var config = ConverterConfig.load(configFile);
        var conversion = config.conversion().toBuilder();
        if (timeout != null) conversion.timeout(timeout);
        if (!blacklist.isEmpty()) {
            var patterns = new ArrayList<>(config.conversion().urlBlacklist());
            patterns.addAll(blacklist);
            conversion.urlBlacklist(patterns);
        }
        var page = config.page();
        if (paperFormat != null) {
            page = new PageSettings(paperFormat, null, null, page.landscape(), page.marginTop(), page.marginBottom(),
                    page.marginLeft(), page.marginRight(), page.scale(), page.printBackground(),
                    page.displayHeaderFooter(), page.headerTemplate(), page.footerTemplate(), page.pageRanges(),
                    page.preferCSSPageSize());
        }
        if (landscape != null) page = page.withLandscape(landscape);
        config = new ConverterConfig(config.instanceId(), config.browser(), conversion.build(), page);

        if (dumpConfig) {
            System.out.println(config.toYaml());
            System.exit(0);
        }

        if (positional.size() != 2) {
            System.err.println("Usage: printroo [options] (URL|FILE|-) OUTPUT");
            System.exit(1);
        }
        String input = positional.get(0);
        Path output = Path.of(positional.get(1));

        try (var converter = config.createConverter()) {
            if (input.equals("-")) {
                String html = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
                if (image) {
                    converter.convertToImage(html, output, config.page(), config.conversion());
                } else {
                    converter.convertToPdf(html, output, config.page(), config.conversion());
                }
            } else {
                Url url = parseInput(input);
                if (image) {
                    converter.convertToImage(url, output, config.page(), config.conversion());
                } else {
                    converter.convertToPdf(url, output, config.page(), config.conversion());
                }
            }
        } catch (ConversionException | ConfigurationException e) {
            log.error("Conversion failed", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
        log.info("Wrote {}", output);
    }

    /**
     * Anything with a scheme is taken as a URL, everything else as a local file.
     */
    static Url parseInput(String input) {
        var url = new Url(input);
        String scheme = url.scheme();
        if (scheme != null && scheme.length() > 1 && scheme.chars().allMatch(c -> Character.isLetterOrDigit(c)
                                                                                 || c == '+' || c == '-' || c == '.')) {
            return url;
        }
        return Url.of(Path.of(input));
    }

    private static void startCdpTraceFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %X{instance} %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("cdp-trace-file");
        fileAppender.setFile(file);
        fileAppender.start();

        var logger = (Logger) LoggerFactory.getLogger(CDPBase.class);
        logger.addAppender(fileAppender);
        if (logger.getEffectiveLevel().toInteger() != Level.TRACE_INT) {
            ThresholdFilter filter = new ThresholdFilter();
            filter.setLevel(logger.getEffectiveLevel().toString());
            filter.start();
            Appender<ILoggingEvent> stderrAppender = context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDERR");
            if (stderrAppender != null) {
                stderrAppender.stop();
                stderrAppender.addFilter(filter);
                stderrAppender.start();
            }
            logger.setLevel(Level.TRACE);
        }
    }
}
