package dev.catananti.stats.dto;

import dev.catananti.stats.entity.DeviceBreakdown;
import dev.catananti.stats.entity.LocationLevel;
import dev.catananti.stats.entity.UtmParamGrouping;
import lombok.Builder;

/**
 * Category-specific parameters of a top-list request. Unset fields fall back to their defaults.
 */
@Builder
public record TopListOptions(LocationLevel locationLevel,
                             DeviceBreakdown deviceBreakdown,
                             UtmParamGrouping utmParamGrouping) {

    public static TopListOptions defaults() {
        return new TopListOptions(null, null, null);
    }

    public LocationLevel locationLevelOrDefault() {
        return locationLevel != null ? locationLevel : LocationLevel.CITIES;
    }

    public DeviceBreakdown deviceBreakdownOrDefault() {
        return deviceBreakdown != null ? deviceBreakdown : DeviceBreakdown.SCREENSIZE;
    }

    public UtmParamGrouping utmParamGroupingOrDefault() {
        return utmParamGrouping != null ? utmParamGrouping : UtmParamGrouping.SOURCE_MEDIUM;
    }
}
