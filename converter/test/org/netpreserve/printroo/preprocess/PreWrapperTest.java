package org.netpreserve.printroo.preprocess;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PreWrapperTest {
    @Test
    void wrapsEscapedText(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("<notes>.txt");
        Files.writeString(input, "if (a < b && c > \"d\") {}\n", StandardCharsets.ISO_8859_1);
        Path output = Files.createDirectory(dir.resolve("out"));

        Path html = new PreWrapper().wrapFile(input, StandardCharsets.ISO_8859_1, output);

        assertEquals(output.resolve("<notes>.txt.html"), html);
        String content = Files.readString(html, StandardCharsets.UTF_8);
        assertTrue(content.contains("<pre>if (a &lt; b &amp;&amp; c &gt; &quot;d&quot;) {}\n</pre>"), content);
        assertTrue(content.contains("<title>&lt;notes&gt;.txt</title>"), content);
        assertTrue(content.contains("<meta charset=\"utf-8\">"), content);
    }

    @Test
    void readsTheGivenCharset(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("latin1.txt");
        Files.write(input, new byte[]{'c', 'a', 'f', (byte) 0xE9});
        Path html = new PreWrapper().wrapFile(input, StandardCharsets.ISO_8859_1, dir);
        assertTrue(Files.readString(html, StandardCharsets.UTF_8).contains("café"));
    }
}
