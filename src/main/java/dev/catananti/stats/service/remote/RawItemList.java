package dev.catananti.stats.service.remote;

import java.util.List;

public record RawItemList(List<RawItem> items) {

    public RawItemList {
        items = List.copyOf(items);
    }
}
