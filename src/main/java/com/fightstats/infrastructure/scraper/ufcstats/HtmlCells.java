package com.fightstats.infrastructure.scraper.ufcstats;

import org.jsoup.nodes.Element;

import java.util.List;

/**
 * Helpers for the stacked {@code <p>} values ufcstats.com puts inside table cells,
 * one per fighter.
 */
final class HtmlCells {

    private HtmlCells() {
    }

    /**
     * Text of each {@code <p>}, blank ones included so indexes stay aligned with fighters.
     */
    static List<String> paragraphTexts(Element cell) {
        return cell.select("p").stream()
            .map(Element::text)
            .toList();
    }

    /**
     * The {@code index}-th stacked value of a cell, or {@code fallback} when the cell has fewer.
     */
    static String paragraphAt(Element cell, int index, String fallback) {
        List<String> texts = paragraphTexts(cell);
        return index < texts.size() ? texts.get(index) : fallback;
    }
}
