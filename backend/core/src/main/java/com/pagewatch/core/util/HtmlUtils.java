package com.pagewatch.core.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.util.Optional;
import java.util.StringJoiner;

public final class HtmlUtils {
    private static final String NOISE_SELECTOR = "script, style, meta, noscript";

    private HtmlUtils() {
    }

    /**
     * Reduces markup to its visible text. Noise elements are dropped together with their content;
     * every remaining text node is stripped at both ends and joined with a single space. Whitespace
     * inside a text node is kept as written.
     */
    public static String normalize(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        Document document = Jsoup.parse(html);
        document.select(NOISE_SELECTOR).remove();

        StringJoiner text = new StringJoiner(" ");
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                String chunk = textNode.getWholeText().strip();
                if (!chunk.isEmpty()) {
                    text.add(chunk);
                }
            }
        }, document);
        return text.toString();
    }

    public static Optional<String> extractTitle(String html) {
        if (html == null || html.isEmpty()) {
            return Optional.empty();
        }
        String title = Jsoup.parse(html).title().trim();
        return title.isEmpty() ? Optional.empty() : Optional.of(title);
    }
}
