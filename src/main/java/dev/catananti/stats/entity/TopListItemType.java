package dev.catananti.stats.entity;

/**
 * Categories of "top N" lists.
 */
public enum TopListItemType {
    POSTS_AND_PAGES("top-posts"),
    AUTHORS("top-authors"),
    REFERRERS("referrers"),
    LOCATIONS("country-views"),
    DEVICES("devices"),
    EXTERNAL_LINKS("clicks"),
    FILE_DOWNLOADS("file-downloads"),
    SEARCH_TERMS("search-terms"),
    VIDEOS("video-plays"),
    ARCHIVE("archives"),
    UTM("utm");

    private final String endpoint;

    TopListItemType(String endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * Path segment of the remote stats endpoint serving this category.
     */
    public String endpoint() {
        return endpoint;
    }
}
