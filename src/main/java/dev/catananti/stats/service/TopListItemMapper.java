package dev.catananti.stats.service;

import dev.catananti.stats.dto.MetricSet;
import dev.catananti.stats.dto.TopListItem;
import dev.catananti.stats.entity.DeviceBreakdown;
import dev.catananti.stats.entity.LocationLevel;
import dev.catananti.stats.entity.SiteMetric;
import dev.catananti.stats.entity.TopListItemType;
import dev.catananti.stats.service.remote.RawDeviceItems;
import dev.catananti.stats.service.remote.RawItem;
import dev.catananti.stats.service.remote.RawUtmItems;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw top-list rows into {@link TopListItem} values of the requested category.
 */
@Slf4j
class TopListItemMapper {

    private static final DateTimeFormatter POST_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId siteZone;

    TopListItemMapper(ZoneId siteZone) {
        this.siteZone = siteZone;
    }

    List<TopListItem> map(TopListItemType type, List<RawItem> rows, LocationLevel locationLevel) {
        if (type == TopListItemType.ARCHIVE) {
            return new ArrayList<>(archiveSections(rows));
        }
        List<TopListItem> items = new ArrayList<>(rows.size());
        for (RawItem row : rows) {
            items.add(map(type, row, locationLevel));
        }
        return items;
    }

    TopListItem map(TopListItemType type, RawItem row, LocationLevel locationLevel) {
        return switch (type) {
            case POSTS_AND_PAGES -> post(row);
            case AUTHORS -> new TopListItem.Author(row.name(), row.id(), row.url(),
                    row.children().stream().map(this::post).toList(), views(row));
            case REFERRERS -> referrer(row);
            case LOCATIONS -> new TopListItem.Location(row.name(), row.countryCode(), locationLevel, views(row));
            case EXTERNAL_LINKS -> externalLink(row);
            case FILE_DOWNLOADS -> new TopListItem.FileDownload(fileName(row), row.url(),
                    metrics(SiteMetric.DOWNLOADS, row.downloads()));
            case SEARCH_TERMS -> new TopListItem.SearchTerm(row.name(), views(row));
            case VIDEOS -> new TopListItem.Video(row.name(), row.id(), row.url(), views(row));
            case ARCHIVE -> new TopListItem.ArchiveItem(row.url(), row.name(), views(row));
            case DEVICES, UTM -> throw new IllegalArgumentException(type + " rows are mapped from their own payload");
        };
    }

    List<TopListItem> devices(RawDeviceItems raw, DeviceBreakdown breakdown) {
        List<TopListItem> items = new ArrayList<>(raw.items().size());
        for (RawDeviceItems.Item item : raw.items()) {
            // Shares are kept as basis points so they fit the integer metric set
            int basisPoints = (int) Math.round(item.percentage() * 100);
            items.add(new TopListItem.Device(item.name(), breakdown, MetricSet.of(SiteMetric.VIEWS, basisPoints)));
        }
        return items;
    }

    List<TopListItem> utm(RawUtmItems raw) {
        List<TopListItem> items = new ArrayList<>(raw.items().size());
        for (RawUtmItems.Item item : raw.items()) {
            items.add(new TopListItem.UtmMetric(String.join(" / ", item.values()), item.values(),
                    item.posts().stream().map(this::post).toList(),
                    MetricSet.of(SiteMetric.VIEWS, item.views())));
        }
        return items;
    }

    /**
     * Groups archive rows by section. Sections without items are dropped; a section's views are the
     * sum of its items' views.
     */
    List<TopListItem.ArchiveSection> archiveSections(List<RawItem> rows) {
        Map<String, List<TopListItem.ArchiveItem>> bySection = new LinkedHashMap<>();
        for (RawItem row : rows) {
            String section = row.section() != null ? row.section() : "other";
            bySection.computeIfAbsent(section, key -> new ArrayList<>())
                    .add(new TopListItem.ArchiveItem(row.url(), row.name(), views(row)));
        }
        List<TopListItem.ArchiveSection> sections = new ArrayList<>();
        bySection.forEach((name, items) -> {
            if (items.isEmpty()) {
                return;
            }
            int total = 0;
            for (TopListItem.ArchiveItem item : items) {
                Integer views = item.metricValue(SiteMetric.VIEWS);
                total += views != null ? views : 0;
            }
            sections.add(new TopListItem.ArchiveSection(name, items, MetricSet.of(SiteMetric.VIEWS, total)));
        });
        return sections;
    }

    private TopListItem.Post post(RawItem row) {
        return new TopListItem.Post(row.name(), row.id(), row.url(), postDate(row.date()), row.kind(), views(row));
    }

    private TopListItem.Referrer referrer(RawItem row) {
        return new TopListItem.Referrer(row.name(), domain(row.url()), null,
                row.children().stream().map(this::referrer).toList(), views(row));
    }

    private TopListItem.ExternalLink externalLink(RawItem row) {
        return new TopListItem.ExternalLink(row.url(), row.name(),
                row.children().stream().map(this::externalLink).toList(), views(row));
    }

    private Instant postDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, POST_DATE).atZone(siteZone).toInstant();
        } catch (DateTimeException e) {
            log.debug("Ignoring unparseable post date '{}'", value);
            return null;
        }
    }

    private static String fileName(RawItem row) {
        if (row.name() != null) {
            return row.name();
        }
        String path = row.url();
        if (path == null) {
            return null;
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String domain(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : url;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    private static MetricSet<SiteMetric> views(RawItem row) {
        return metrics(SiteMetric.VIEWS, row.views());
    }

    private static MetricSet<SiteMetric> metrics(SiteMetric metric, Integer value) {
        return MetricSet.empty(SiteMetric.class).with(metric, value);
    }
}
