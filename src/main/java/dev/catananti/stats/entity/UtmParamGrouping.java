package dev.catananti.stats.entity;

/**
 * UTM parameter combinations a UTM top list can be grouped by.
 */
public enum UtmParamGrouping {
    SOURCE_MEDIUM("utm_source,utm_medium"),
    CAMPAIGN_SOURCE_MEDIUM("utm_campaign,utm_source,utm_medium"),
    SOURCE("utm_source"),
    MEDIUM("utm_medium"),
    CAMPAIGN("utm_campaign");

    private final String parameters;

    UtmParamGrouping(String parameters) {
        this.parameters = parameters;
    }

    public String parameters() {
        return parameters;
    }
}
