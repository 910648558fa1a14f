package com.fightstats.domain.ports;

import com.fightstats.domain.exception.FetchException;
import org.jsoup.nodes.Document;

/**
 * Port for retrieving and parsing a remote HTML page.
 */
public interface DocumentFetcher {

    /**
     * Fetches the page at {@code url}.
     *
     * @param url absolute page URL
     * @return parsed document, with {@code url} as its base URI
     * @throws FetchException if the page could not be retrieved, including when the
     *                        source kept rate-limiting past the retry bound
     */
    Document fetch(String url) throws FetchException;
}
