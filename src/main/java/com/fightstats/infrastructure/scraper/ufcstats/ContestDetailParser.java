package com.fightstats.infrastructure.scraper.ufcstats;

import com.fightstats.domain.model.ContestParticipantResult;
import com.fightstats.domain.model.ContestResult;
import com.fightstats.domain.model.Fraction;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the per-fighter totals of a fight-details page.
 * <p>
 * Only pages with exactly two fighter blocks and a totals row are accepted. Totals come
 * from the first table on the page: 2 significant strikes, 5 takedowns, 7 submission
 * attempts, 9 control time, each cell stacking one {@code <p>} per fighter.
 */
public class ContestDetailParser {

    private static final int MIN_CELLS = 10;
    private static final int STRIKES_CELL = 2;
    private static final int TAKEDOWNS_CELL = 5;
    private static final int SUBMISSIONS_CELL = 7;
    private static final int CONTROL_CELL = 9;

    private record Participant(String id, String outcome) {}

    public Optional<ContestResult> parse(Document document, String contestId) {
        List<Participant> participants = participants(document);
        if (participants.size() != 2) {
            return Optional.empty();
        }

        Element table = document.selectFirst("table");
        Element tbody = table == null ? null : table.selectFirst("tbody");
        Element row = tbody == null ? null : tbody.selectFirst("tr");
        if (row == null) {
            return Optional.empty();
        }
        Elements cells = row.select("td");
        if (cells.size() < MIN_CELLS) {
            return Optional.empty();
        }

        List<ContestParticipantResult> rows = new ArrayList<>(2);
        for (int idx = 0; idx < 2; idx++) {
            Fraction strikes = FieldNormalizers.fraction(HtmlCells.paragraphAt(cells.get(STRIKES_CELL), idx, ""));
            Fraction takedowns = FieldNormalizers.fraction(HtmlCells.paragraphAt(cells.get(TAKEDOWNS_CELL), idx, ""));
            int submissions = FieldNormalizers.count(HtmlCells.paragraphAt(cells.get(SUBMISSIONS_CELL), idx, "0"));
            int control = FieldNormalizers.controlSeconds(HtmlCells.paragraphAt(cells.get(CONTROL_CELL), idx, "0:00"));

            Participant participant = participants.get(idx);
            rows.add(new ContestParticipantResult(
                contestId,
                participant.id(),
                participant.outcome(),
                strikes.landed(),
                strikes.attempted(),
                takedowns.landed(),
                takedowns.attempted(),
                submissions,
                control
            ));
        }
        return Optional.of(ContestResult.of(rows));
    }

    private static List<Participant> participants(Document document) {
        List<Participant> participants = new ArrayList<>();
        for (Element person : document.select("div.b-fight-details__person")) {
            Element link = person.selectFirst("a.b-fight-details__person-link");
            if (link == null) {
                link = person.selectFirst("a.b-link");
            }
            if (link == null) {
                continue;
            }
            Element status = person.selectFirst("i.b-fight-details__person-status");
            participants.add(new Participant(
                UfcStatsUrls.idOf(link.attr("href")),
                status == null ? "" : status.text()
            ));
        }
        return participants;
    }
}
