package com.fightstats.infrastructure.scraper.ufcstats;

import com.fightstats.domain.model.Contest;
import com.fightstats.domain.model.Event;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the bouts table of an event-details page.
 * <p>
 * Cell layout: 6 weight class, 7 method (short label over a detail line), 8 round.
 */
public class EventDetailParser {

    private static final int MIN_CELLS = 10;
    private static final int CATEGORY_CELL = 6;
    private static final int METHOD_CELL = 7;
    private static final int ROUND_CELL = 8;

    public List<Contest> parse(Document document, Event event) {
        Element tbody = document.selectFirst("table.b-fight-details__table tbody");
        if (tbody == null) {
            return List.of();
        }

        List<Contest> contests = new ArrayList<>();
        for (Element row : tbody.select("tr")) {
            // header and spacer rows carry no data-link
            String contestUrl = row.attr("data-link").trim();
            if (contestUrl.isEmpty()) {
                continue;
            }
            Elements cells = row.select("td");
            if (cells.size() < MIN_CELLS) {
                continue;
            }
            String id = UfcStatsUrls.idOf(contestUrl);
            if (id.isEmpty()) {
                continue;
            }

            Element methodCell = cells.get(METHOD_CELL);
            List<String> methodLines = HtmlCells.paragraphTexts(methodCell);
            String method = methodLines.isEmpty() ? methodCell.text() : methodLines.get(0);

            contests.add(new Contest(
                id,
                event.id(),
                event.date(),
                cells.get(CATEGORY_CELL).text(),
                method,
                parseRound(cells.get(ROUND_CELL).text())
            ));
        }
        return contests;
    }

    private static Integer parseRound(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)
            ? null
            : FieldNormalizers.count(trimmed);
    }
}
