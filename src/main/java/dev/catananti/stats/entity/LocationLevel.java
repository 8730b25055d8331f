package dev.catananti.stats.entity;

public enum LocationLevel {
    COUNTRIES,
    REGIONS,
    CITIES
}
