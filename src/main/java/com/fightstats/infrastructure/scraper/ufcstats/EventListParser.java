package com.fightstats.infrastructure.scraper.ufcstats;

import com.fightstats.domain.model.Event;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the completed-events listing into {@link Event}s, newest first as listed.
 */
public class EventListParser {

    public List<Event> parse(Document document) {
        List<Event> events = new ArrayList<>();
        for (Element row : document.select("table.b-statistics__table-events tr.b-statistics__table-row")) {
            Element link = row.selectFirst("a.b-link");
            Element date = row.selectFirst("span.b-statistics__date");
            if (link == null || date == null) {
                continue;
            }
            String url = link.attr("href").trim();
            String id = UfcStatsUrls.idOf(url);
            if (id.isEmpty()) {
                continue;
            }
            events.add(new Event(id, FieldNormalizers.isoDate(date.text()), url));
        }
        return events;
    }
}
