package dev.catananti.stats.dto;

/**
 * Newsletter delivery stats of a post. Fields the API leaves out stay {@code null}.
 */
public record EmailOpensResponse(Integer totalSends,
                                 Integer uniqueOpens,
                                 Integer totalOpens,
                                 Double opensRate) {
}
