package dev.catananti.stats.exception;

import dev.catananti.stats.entity.SiteMetric;
import dev.catananti.stats.entity.TopListItemType;

/**
 * Thrown when a top list is requested for a metric its category does not report.
 */
public class UnsupportedCombinationException extends IllegalArgumentException {

    private final TopListItemType item;
    private final SiteMetric metric;

    public UnsupportedCombinationException(TopListItemType item, SiteMetric metric) {
        super("Metric " + metric + " is not supported for " + item);
        this.item = item;
        this.metric = metric;
    }

    public TopListItemType getItem() {
        return item;
    }

    public SiteMetric getMetric() {
        return metric;
    }
}
