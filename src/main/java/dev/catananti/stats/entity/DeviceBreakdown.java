package dev.catananti.stats.entity;

import java.util.Locale;

public enum DeviceBreakdown {
    SCREENSIZE,
    PLATFORM,
    BROWSER;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
