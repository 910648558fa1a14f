package com.fightstats.infrastructure.scraper.ufcstats;

import com.fightstats.domain.model.Event;
import com.fightstats.support.HtmlFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventListParser.
 */
class EventListParserTest {

    private final EventListParser parser = new EventListParser();

    @Test
    void testParsesEventRowsAndNormalizesDates() {
        List<Event> events = parser.parse(HtmlFixtures.document("events_completed.html", "http://ufcstats.com/"));

        assertEquals(2, events.size());

        Event first = events.get(0);
        assertEquals("6e2b1d631832921d", first.id());
        assertEquals("2026-02-21", first.date());
        assertEquals("http://ufcstats.com/event-details/6e2b1d631832921d/", first.sourceUrl());

        Event second = events.get(1);
        assertEquals("a9df5ae20a97b090", second.id());
        assertEquals("2026-03-01", second.date());
    }

    @Test
    void testUnparseableDatePassesThrough() {
        String html = "<table class=\"b-statistics__table-events\"><tbody>"
            + "<tr class=\"b-statistics__table-row\"><td>"
            + "<a class=\"b-link\" href=\"http://ufcstats.com/event-details/abc123\">UFC 999</a>"
            + "<span class=\"b-statistics__date\">Date TBA</span>"
            + "</td></tr></tbody></table>";

        List<Event> events = parser.parse(org.jsoup.Jsoup.parse(html));

        assertEquals(1, events.size());
        assertEquals("Date TBA", events.get(0).date());
    }

    @Test
    void testMissingTableYieldsNothing() {
        assertTrue(parser.parse(HtmlFixtures.document("no_anchor.html", "http://ufcstats.com/")).isEmpty());
    }
}
