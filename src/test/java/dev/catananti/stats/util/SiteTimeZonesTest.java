package dev.catananti.stats.util;

import dev.catananti.stats.entity.DateInterval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SiteTimeZones")
class SiteTimeZonesTest {

    private static final ZoneId SITE = ZoneId.of("America/New_York");
    private static final ZoneId LOCAL = ZoneId.of("Europe/Warsaw");

    private final SiteTimeZones timeZones = new SiteTimeZones(LOCAL);

    private static Instant at(ZoneId zone, int year, int month, int day, int hour, int minute) {
        return LocalDateTime.of(year, month, day, hour, minute).atZone(zone).toInstant();
    }

    @Nested
    @DisplayName("toLocal() / toSiteTimeZone()")
    class Conversion {

        @Test
        @DisplayName("should keep the wall-clock time and swap the zone")
        void shouldKeepWallClock() {
            Instant siteNoon = at(SITE, 2025, 1, 5, 12, 0);

            Instant local = timeZones.toLocal(siteNoon, SITE);

            assertThat(local.atZone(LOCAL).toLocalDateTime()).isEqualTo(LocalDateTime.of(2025, 1, 5, 12, 0));
        }

        @Test
        @DisplayName("should round-trip to the same instant")
        void shouldRoundTrip() {
            Instant date = at(SITE, 2025, 3, 20, 17, 45);

            assertThat(timeZones.toSiteTimeZone(timeZones.toLocal(date, SITE), SITE)).isEqualTo(date);
        }

        @Test
        @DisplayName("should drop sub-second precision")
        void shouldDropNanos() {
            Instant date = at(SITE, 2025, 1, 5, 12, 0).plusNanos(123_456_789);

            Instant local = timeZones.toLocal(date, SITE);

            assertThat(local.getNano()).isZero();
        }

        @Test
        @DisplayName("should return the input unchanged when the wall-clock time does not exist locally")
        void dstGap_shouldReturnInput() {
            // 02:30 on 2025-03-30 is skipped in Warsaw
            Instant siteTime = at(SITE, 2025, 3, 30, 2, 30);

            assertThat(timeZones.toLocal(siteTime, SITE)).isEqualTo(siteTime);
        }
    }

    @Nested
    @DisplayName("normalizeInterval()")
    class NormalizeInterval {

        @Test
        @DisplayName("should convert bounds and make the end inclusive")
        void shouldConvertAndStepBack() {
            DateInterval interval = new DateInterval(at(SITE, 2025, 1, 1, 0, 0), at(SITE, 2025, 1, 8, 0, 0));

            DateInterval normalized = timeZones.normalizeInterval(interval, SITE);

            assertThat(normalized.start().atZone(LOCAL).toLocalDateTime()).isEqualTo(LocalDateTime.of(2025, 1, 1, 0, 0));
            assertThat(normalized.end().atZone(LOCAL).toLocalDateTime())
                    .isEqualTo(LocalDateTime.of(2025, 1, 7, 23, 59, 59));
        }
    }

    @Nested
    @DisplayName("containsCurrentDate()")
    class ContainsCurrentDate {

        private final Instant now = at(SITE, 2025, 1, 5, 10, 0);

        @Test
        @DisplayName("should be true for a range containing today")
        void rangeWithToday_shouldBeTrue() {
            DateInterval interval = new DateInterval(at(SITE, 2025, 1, 1, 0, 0), at(SITE, 2025, 1, 8, 0, 0));

            assertThat(timeZones.containsCurrentDate(interval, SITE, now)).isTrue();
        }

        @Test
        @DisplayName("should be false for a range ending at today's midnight")
        void rangeEndingAtMidnight_shouldBeFalse() {
            DateInterval interval = new DateInterval(at(SITE, 2024, 12, 29, 0, 0), at(SITE, 2025, 1, 5, 0, 0));

            assertThat(timeZones.containsCurrentDate(interval, SITE, now)).isFalse();
        }

        @Test
        @DisplayName("should use the site's calendar day, not UTC")
        void shouldUseSiteDay() {
            // 23:30 in New York is already the next day in UTC
            Instant lateEvening = at(SITE, 2025, 1, 4, 23, 30);
            DateInterval jan4 = new DateInterval(
                    LocalDate.of(2025, 1, 4).atStartOfDay(SITE).toInstant(),
                    LocalDate.of(2025, 1, 5).atStartOfDay(SITE).toInstant());

            assertThat(timeZones.containsCurrentDate(jan4, SITE, lateEvening)).isTrue();
            assertThat(timeZones.isToday(lateEvening, SITE, now)).isFalse();
        }
    }
}
