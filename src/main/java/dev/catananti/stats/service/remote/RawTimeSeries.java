package dev.catananti.stats.service.remote;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Site traffic periods as returned by the visits endpoint.
 */
public record RawTimeSeries(List<Period> periods) {

    public RawTimeSeries {
        periods = List.copyOf(periods);
    }

    /**
     * @param date   period start in the local zone
     * @param values metric values keyed by wire field name ({@code views}, {@code visitors}, ...)
     */
    public record Period(Instant date, Map<String, Integer> values) {
        public Period {
            values = Map.copyOf(values);
        }
    }
}
