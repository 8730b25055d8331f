package dev.catananti.stats.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Site and cache settings of the stats layer.
 */
@Component
@Getter
@Slf4j
public class StatsConfig {

    private final long siteId;
    private final ZoneId siteTimeZone;
    private final ZoneId localTimeZone;
    private final Duration currentPeriodTtl;
    private final long cacheMaximumSize;
    private final Locale locale;

    public StatsConfig(
            @Value("${stats.site-id:0}") long siteId,
            @Value("${stats.site-time-zone:UTC}") String siteTimeZone,
            @Value("${stats.local-time-zone:}") String localTimeZone,
            @Value("${stats.cache.current-period-ttl-seconds:30}") int currentPeriodTtlSeconds,
            @Value("${stats.cache.maximum-size:1000}") long cacheMaximumSize,
            @Value("${stats.locale:en}") String locale
    ) {
        this.siteId = siteId;
        this.siteTimeZone = ZoneId.of(siteTimeZone);
        this.localTimeZone = localTimeZone == null || localTimeZone.isBlank()
                ? ZoneId.systemDefault()
                : ZoneId.of(localTimeZone);
        this.currentPeriodTtl = Duration.ofSeconds(currentPeriodTtlSeconds);
        this.cacheMaximumSize = cacheMaximumSize;
        this.locale = Locale.forLanguageTag(locale);
        log.info("Stats configuration initialized (site={}, siteZone={}, localZone={}, currentPeriodTtl={})",
                siteId, this.siteTimeZone, this.localTimeZone, currentPeriodTtl);
    }
}
