package dev.catananti.stats.dto;

import java.util.List;

public record TopListResponse(List<TopListItem> items) {

    public TopListResponse {
        items = List.copyOf(items);
    }

    public static TopListResponse empty() {
        return new TopListResponse(List.of());
    }
}
