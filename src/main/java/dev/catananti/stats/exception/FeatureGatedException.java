package dev.catananti.stats.exception;

import dev.catananti.stats.entity.TopListItemType;

/**
 * Thrown when a top-list category requires a plan upgrade for the site.
 */
public class FeatureGatedException extends RuntimeException {

    private final TopListItemType item;

    public FeatureGatedException(TopListItemType item, String message, Throwable cause) {
        super(message, cause);
        this.item = item;
    }

    public TopListItemType getItem() {
        return item;
    }
}
