package com.fightstats.support;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads the HTML pages under src/test/resources/html.
 */
public final class HtmlFixtures {

    private HtmlFixtures() {
    }

    public static String html(String name) {
        try (InputStream in = HtmlFixtures.class.getResourceAsStream("/html/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture named " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Document document(String name, String baseUri) {
        return Jsoup.parse(html(name), baseUri);
    }
}
