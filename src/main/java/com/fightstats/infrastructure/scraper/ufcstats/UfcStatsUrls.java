package com.fightstats.infrastructure.scraper.ufcstats;

/**
 * URL layout of ufcstats.com and the id rule shared by every dataset.
 */
public class UfcStatsUrls {

    private final String baseUrl;

    public UfcStatsUrls(String baseUrl) {
        this.baseUrl = stripTrailingSlashes(baseUrl);
    }

    public String completedEvents() {
        return baseUrl + "/statistics/events/completed?page=all";
    }

    public String fighterListing(char letter) {
        return baseUrl + "/statistics/fighters?char=" + letter + "&page=all";
    }

    public String contestDetails(String contestId) {
        return baseUrl + "/fight-details/" + contestId;
    }

    public String fighterDetails(String fighterId) {
        return baseUrl + "/fighter-details/" + fighterId;
    }

    /**
     * Primary id of a detail page: the last path segment after trimming trailing slashes.
     * Returns an empty string for a null or blank URL.
     */
    public static String idOf(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = stripTrailingSlashes(url.trim());
        int slash = trimmed.lastIndexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
