package dev.catananti.stats.util;

import dev.catananti.stats.dto.TopListItem;
import dev.catananti.stats.entity.SiteMetric;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic ordering for top lists of every category.
 * <p>
 * Sorting rules:
 * <ul>
 *   <li>Metric value descending, items without a value last</li>
 *   <li>Then display name, compared with a locale-aware {@link Collator}</li>
 *   <li>Then item id ascending</li>
 * </ul>
 */
public final class TopListRanker {

    private TopListRanker() {}

    public static Comparator<TopListItem> comparator(SiteMetric metric, Locale locale) {
        // Collator instances are not thread-safe
        Collator collator = Collator.getInstance(locale);
        Comparator<String> names = collator::compare;
        Comparator<TopListItem> byMetric = Comparator.comparing(
                (TopListItem item) -> item.metricValue(metric),
                Comparator.nullsLast(Comparator.<Integer>reverseOrder()));
        Comparator<TopListItem> byName = Comparator.comparing(
                TopListItem::displayName,
                Comparator.nullsLast(names));
        Comparator<TopListItem> byId = Comparator.comparing(
                (TopListItem item) -> item.id().id(),
                Comparator.nullsLast(Comparator.<String>naturalOrder()));
        return byMetric.thenComparing(byName).thenComparing(byId);
    }

    /**
     * Returns a new list holding the top {@code limit} items; a non-positive limit keeps every item.
     */
    public static <T extends TopListItem> List<T> rank(List<T> items, SiteMetric metric, Locale locale, int limit) {
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(comparator(metric, locale));
        if (limit > 0 && sorted.size() > limit) {
            return List.copyOf(sorted.subList(0, limit));
        }
        return List.copyOf(sorted);
    }
}
