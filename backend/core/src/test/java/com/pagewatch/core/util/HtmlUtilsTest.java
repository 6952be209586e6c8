package com.pagewatch.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HtmlUtilsTest {
    @Test
    void normalizeExtractsVisibleText() {
        assertEquals("Hello", HtmlUtils.normalize("<html><body>Hello</body></html>"));
        assertEquals("Hello World", HtmlUtils.normalize("<html><body>Hello World</body></html>"));
    }

    @Test
    void normalizeDropsScriptStyleMetaAndNoscriptBlocks() {
        String html = """
                <html><head>
                  <meta name="generator" content="secret-generator">
                  <style>body { color: red; }</style>
                  <script>var tracking = "token-123";</script>
                </head><body>
                  <noscript>Enable JavaScript</noscript>
                  <p>Visible</p>
                  <script type="text/javascript">document.write("late")</script>
                </body></html>
                """;

        String text = HtmlUtils.normalize(html);

        assertEquals("Visible", text);
        assertFalse(text.contains("token-123"));
        assertFalse(text.contains("color: red"));
        assertFalse(text.contains("Enable JavaScript"));
        assertFalse(text.contains("secret-generator"));
    }

    @Test
    void normalizeCollapsesWhitespaceBetweenElements() {
        String html = "<div>\n  <h1> Title </h1>\n\n<p>first line</p><span>a</span><span>b</span>\t</div>";

        assertEquals("Title first line a b", HtmlUtils.normalize(html));
    }

    @Test
    void normalizeKeepsWhitespaceInsideTextNodes() {
        String text = HtmlUtils.normalize("<pre>a    b\n\tc</pre><p>x  y</p>");

        assertEquals("a    b\n\tc x  y", text);
        assertEquals(14, text.length());
        assertFalse(HtmlUtils.normalize("<p>x  y</p>").equals(HtmlUtils.normalize("<p>x y</p>")));
    }

    @Test
    void normalizeHandlesNullAndEmptyInput() {
        assertEquals("", HtmlUtils.normalize(null));
        assertEquals("", HtmlUtils.normalize(""));
        assertEquals("", HtmlUtils.normalize("<html><head><script>x()</script></head><body> </body></html>"));
    }

    @Test
    void normalizeIsDeterministic() {
        String html = "<ul><li>one</li><li>two</li><li>three</li></ul><style>.x{}</style>";

        assertEquals(HtmlUtils.normalize(html), HtmlUtils.normalize(html));
        assertEquals("one two three", HtmlUtils.normalize(html));
    }

    @Test
    void titleExtractionHandlesEdgeCases() {
        assertTrue(HtmlUtils.extractTitle("<html><body>No title</body></html>").isEmpty());
        assertTrue(HtmlUtils.extractTitle(null).isEmpty());
        assertEquals("UPPER", HtmlUtils.extractTitle("<html><head><TITLE>UPPER</TITLE></head></html>").orElseThrow());
        assertEquals(
                "Hello World",
                HtmlUtils.extractTitle("<html><head><title>\n  Hello   World \n</title></head></html>").orElseThrow()
        );
    }
}
