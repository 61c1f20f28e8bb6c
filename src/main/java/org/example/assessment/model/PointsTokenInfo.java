package org.example.assessment.model;

public record PointsTokenInfo(
        String name,
        String symbol,
        int decimals,
        String totalSupply,
        long holderCount,
        String minter
) {
}
