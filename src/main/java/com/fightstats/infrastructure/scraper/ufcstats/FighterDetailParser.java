package com.fightstats.infrastructure.scraper.ufcstats;

import com.fightstats.domain.model.FightRecord;
import com.fightstats.domain.model.FighterProfile;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a fighter-details page into a {@link FighterProfile}.
 * <p>
 * Bio and career statistics are list items of the form {@code <i>Label:</i> value}.
 * A page without the name heading is treated as "no fighter here".
 */
public class FighterDetailParser {

    private final Clock clock;

    public FighterDetailParser(Clock clock) {
        this.clock = clock;
    }

    public Optional<FighterProfile> parse(Document document, String fighterId) {
        Element name = document.selectFirst("span.b-content__title-highlight");
        if (name == null) {
            return Optional.empty();
        }
        Element record = document.selectFirst("span.b-content__title-record");
        Element nickname = document.selectFirst("p.b-content__Nickname");

        Map<String, String> stats = labeledValues(document);
        FightRecord fightRecord = FieldNormalizers.fightRecord(record == null ? "" : record.text());
        LocalDate today = LocalDate.now(clock);

        return Optional.of(new FighterProfile(
            fighterId,
            FieldNormalizers.textOrNull(name.text()),
            nickname == null ? null : FieldNormalizers.textOrNull(nickname.text()),
            fightRecord.wins(),
            fightRecord.losses(),
            fightRecord.ties(),
            FieldNormalizers.heightInches(stats.get("Height")),
            FieldNormalizers.weightPounds(stats.get("Weight")),
            FieldNormalizers.reachInches(stats.get("Reach")),
            FieldNormalizers.textOrNull(stats.get("STANCE")),
            FieldNormalizers.age(stats.get("DOB"), today),
            FieldNormalizers.decimal(stats.get("SLpM")),
            FieldNormalizers.percentage(stats.get("Str. Acc.")),
            FieldNormalizers.decimal(stats.get("SApM")),
            FieldNormalizers.percentage(stats.get("Str. Def")),
            FieldNormalizers.decimal(stats.get("TD Avg.")),
            FieldNormalizers.percentage(stats.get("TD Acc.")),
            FieldNormalizers.percentage(stats.get("TD Def.")),
            FieldNormalizers.decimal(stats.get("Sub. Avg."))
        ));
    }

    private static Map<String, String> labeledValues(Document document) {
        Map<String, String> values = new HashMap<>();
        for (Element item : document.select("li.b-list__box-list-item")) {
            Element label = item.selectFirst("i");
            if (label == null) {
                continue;
            }
            String labelText = label.text();
            String key = labelText.replace(":", "").trim();
            if (key.isEmpty()) {
                continue;
            }
            String value = item.text().replace(labelText, "").trim();
            values.put(key, value);
        }
        return values;
    }
}
