package dev.catananti.stats.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import dev.catananti.stats.entity.DeviceBreakdown;
import dev.catananti.stats.entity.LocationLevel;
import dev.catananti.stats.entity.SiteMetric;
import dev.catananti.stats.entity.TopListItemType;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * An entry of a "top N" list. Every variant exposes an identifier, a display name and its metrics;
 * ranking only ever looks at those three.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TopListItem.Post.class, name = "post"),
        @JsonSubTypes.Type(value = TopListItem.Author.class, name = "author"),
        @JsonSubTypes.Type(value = TopListItem.Referrer.class, name = "referrer"),
        @JsonSubTypes.Type(value = TopListItem.Location.class, name = "location"),
        @JsonSubTypes.Type(value = TopListItem.Device.class, name = "device"),
        @JsonSubTypes.Type(value = TopListItem.ExternalLink.class, name = "externalLink"),
        @JsonSubTypes.Type(value = TopListItem.FileDownload.class, name = "fileDownload"),
        @JsonSubTypes.Type(value = TopListItem.SearchTerm.class, name = "searchTerm"),
        @JsonSubTypes.Type(value = TopListItem.Video.class, name = "video"),
        @JsonSubTypes.Type(value = TopListItem.ArchiveItem.class, name = "archiveItem"),
        @JsonSubTypes.Type(value = TopListItem.ArchiveSection.class, name = "archiveSection"),
        @JsonSubTypes.Type(value = TopListItem.UtmMetric.class, name = "utm")
})
public sealed interface TopListItem {

    @JsonProperty("id")
    TopListItemId id();

    @JsonProperty("displayName")
    String displayName();

    MetricSet<SiteMetric> metrics();

    default Integer metricValue(SiteMetric metric) {
        return metrics().valueOf(metric);
    }

    record Post(String title, String postId, String postUrl, Instant date, String type,
                MetricSet<SiteMetric> metrics) implements TopListItem {
        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.POSTS_AND_PAGES, postId);
        }

        @Override
        public String displayName() {
            return title;
        }
    }

    record Author(String name, String userId, String avatarUrl, List<Post> posts,
                  MetricSet<SiteMetric> metrics) implements TopListItem {
        public Author {
            posts = posts == null ? List.of() : List.copyOf(posts);
        }

        /** Falls back to the author name when the remote API omits the user id. */
        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.AUTHORS, userId != null ? userId : name);
        }

        @Override
        public String displayName() {
            return name;
        }
    }

    record Referrer(String name, String domain, String iconUrl, List<Referrer> children,
                    MetricSet<SiteMetric> metrics) implements TopListItem {
        public Referrer {
            children = children == null ? List.of() : List.copyOf(children);
        }

        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.REFERRERS, (domain != null ? domain : "-") + name);
        }

        @Override
        public String displayName() {
            return name;
        }
    }

    record Location(String name, String countryCode, LocationLevel level,
                    MetricSet<SiteMetric> metrics) implements TopListItem {
        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.LOCATIONS,
                    (countryCode != null ? countryCode : "-") + ":" + name);
        }

        @Override
        public String displayName() {
            return name;
        }
    }

    record Device(String name, DeviceBreakdown breakdown, MetricSet<SiteMetric> metrics) implements TopListItem {
        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.DEVICES, breakdown.value() + ":" + name);
        }

        @Override
        public String displayName() {
            return capitalizeWords(name);
        }
    }

    record ExternalLink(String url, String title, List<ExternalLink> children,
                        MetricSet<SiteMetric> metrics) implements TopListItem {
        public ExternalLink {
            children = children == null ? List.of() : List.copyOf(children);
        }

        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.EXTERNAL_LINKS, (url != null ? url : "") + title);
        }

        @Override
        public String displayName() {
            return title;
        }
    }

    record FileDownload(String fileName, String filePath, MetricSet<SiteMetric> metrics) implements TopListItem {
        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.FILE_DOWNLOADS, filePath != null ? filePath : fileName);
        }

        @Override
        public String displayName() {
            return fileName;
        }
    }

    record SearchTerm(String term, MetricSet<SiteMetric> metrics) implements TopListItem {
        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.SEARCH_TERMS, term);
        }

        @Override
        public String displayName() {
            return term;
        }
    }

    record Video(String title, String postId, String videoUrl, MetricSet<SiteMetric> metrics) implements TopListItem {
        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.VIDEOS, postId);
        }

        @Override
        public String displayName() {
            return title;
        }
    }

    record ArchiveItem(String href, String value, MetricSet<SiteMetric> metrics) implements TopListItem {
        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.ARCHIVE, href);
        }

        @Override
        public String displayName() {
            return value;
        }
    }

    record ArchiveSection(String sectionName, List<ArchiveItem> items,
                          MetricSet<SiteMetric> metrics) implements TopListItem {
        public ArchiveSection {
            items = List.copyOf(items);
        }

        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.ARCHIVE, sectionName);
        }

        @Override
        public String displayName() {
            return capitalizeWords(sectionName);
        }
    }

    record UtmMetric(String label, List<String> values, List<Post> posts,
                     MetricSet<SiteMetric> metrics) implements TopListItem {
        public UtmMetric {
            values = values == null ? List.of() : List.copyOf(values);
            posts = posts == null ? List.of() : List.copyOf(posts);
        }

        @Override
        public TopListItemId id() {
            return new TopListItemId(TopListItemType.UTM, label);
        }

        @Override
        public String displayName() {
            return label;
        }
    }

    private static String capitalizeWords(String value) {
        if (value == null || value.isBlank()) {
            return value;
        }
        return Arrays.stream(value.split(" "))
                .map(word -> word.isEmpty() ? word
                        : word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}
