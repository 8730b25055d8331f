package dev.catananti.stats.dto;

import java.util.List;

/**
 * The most recent likers of a post; {@code totalCount} counts every like, not just the listed ones.
 */
public record PostLikesResponse(List<Liker> users, int totalCount) {

    public PostLikesResponse {
        users = List.copyOf(users);
    }

    public record Liker(long id, String name, String avatarUrl) {
    }
}
