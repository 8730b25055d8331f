package dev.catananti.stats.service.remote;

import java.util.List;

/**
 * One row of a top-list payload. Which fields are populated depends on the category:
 * <ul>
 *   <li>posts and videos: {@code id} (post id), {@code name} (title), {@code url}, {@code date}, {@code kind}</li>
 *   <li>authors: {@code id} (user id, may be null), {@code name}, {@code url} (avatar), {@code children} (posts)</li>
 *   <li>referrers and external links: {@code name}, {@code url}, {@code children}</li>
 *   <li>locations: {@code name}, {@code countryCode}</li>
 *   <li>file downloads: {@code name} (file name), {@code url} (file path)</li>
 *   <li>archive: {@code section}, {@code name} (value), {@code url} (href)</li>
 * </ul>
 */
public record RawItem(String id,
                      String name,
                      String url,
                      String countryCode,
                      String section,
                      String kind,
                      String date,
                      Integer views,
                      Integer downloads,
                      List<RawItem> children) {

    public RawItem {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
