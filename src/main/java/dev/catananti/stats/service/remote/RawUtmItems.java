package dev.catananti.stats.service.remote;

import java.util.List;

public record RawUtmItems(List<Item> items) {

    public RawUtmItems {
        items = List.copyOf(items);
    }

    /**
     * @param values parameter values in grouping order, e.g. {@code [google, cpc]}
     * @param posts  top posts reached through this parameter combination
     */
    public record Item(List<String> values, int views, List<RawItem> posts) {
        public Item {
            values = List.copyOf(values);
            posts = posts == null ? List.of() : List.copyOf(posts);
        }
    }
}
