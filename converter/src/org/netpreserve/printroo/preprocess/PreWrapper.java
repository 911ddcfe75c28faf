package org.netpreserve.printroo.preprocess;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Turns a plain-text file into an HTML page that shows the text as-is.
 */
public class PreWrapper {
    private static final Logger log = LoggerFactory.getLogger(PreWrapper.class);
    private static final String[] HTML_CHARS = {"&", "<", ">", "\""};
    private static final String[] HTML_ENTITIES = {"&amp;", "&lt;", "&gt;", "&quot;"};
    private final String style;

    public PreWrapper() {
        this("white-space: pre-wrap; word-wrap: break-word; font-family: monospace;");
    }

    /**
     * @param style CSS applied to the {@code <pre>} element
     */
    public PreWrapper(String style) {
        this.style = style;
    }

    /**
     * Writes {@code <name>.html} into the directory and returns its path.
     *
     * @param charset encoding of the input file
     */
    public Path wrapFile(Path input, Charset charset, Path directory) throws IOException {
        String text = Files.readString(input, charset);
        String title = escape(input.getFileName().toString());
        String html = "<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n<title>" + title + "</title>\n" +
                      "<style>pre { " + style + " }</style>\n</head>\n<body>\n<pre>" + escape(text) +
                      "</pre>\n</body>\n</html>\n";
        Path output = directory.resolve(input.getFileName() + ".html");
        Files.writeString(output, html, UTF_8);
        log.debug("Wrapped {} into {}", input, output);
        return output;
    }

    static String escape(String text) {
        return StringUtils.replaceEach(text, HTML_CHARS, HTML_ENTITIES);
    }
}
