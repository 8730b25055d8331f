package dev.catananti.stats.dto;

import dev.catananti.stats.entity.TopListItemType;

/**
 * Identity of a top-list item, unique within its category.
 */
public record TopListItemId(TopListItemType type, String id) {
}
