package com.fightstats.infrastructure.scraper.ufcstats;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads fighter ids from one letter of the fighters listing.
 */
public class FighterListParser {

    public Set<String> parse(Document document) {
        Element table = document.selectFirst("table");
        Element tbody = table == null ? null : table.selectFirst("tbody");
        if (tbody == null) {
            return Set.of();
        }

        Set<String> ids = new LinkedHashSet<>();
        for (Element row : tbody.select("tr")) {
            Element link = row.selectFirst("a[href]");
            if (link == null) {
                continue;
            }
            String id = UfcStatsUrls.idOf(link.attr("href"));
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }
}
