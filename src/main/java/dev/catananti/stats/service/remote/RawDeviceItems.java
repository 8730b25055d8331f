package dev.catananti.stats.service.remote;

import java.util.List;

/**
 * Device breakdown shares; {@code percentage} is 0-100 with fractional precision.
 */
public record RawDeviceItems(List<Item> items) {

    public RawDeviceItems {
        items = List.copyOf(items);
    }

    public record Item(String name, double percentage) {
    }
}
