package com.propertyprice.map.domain.model;

import java.util.Optional;

/**
 * Fixed price ranges used by price-mode clustering. Lower bound inclusive,
 * upper bound exclusive.
 */
public enum PriceBucket {
    UNDER_100K(0L, 100_000L),
    FROM_100K(100_000L, 200_000L),
    FROM_200K(200_000L, 300_000L),
    FROM_300K(300_000L, 400_000L),
    FROM_400K(400_000L, 500_000L),
    FROM_500K(500_000L, 750_000L),
    FROM_750K(750_000L, 1_000_000L),
    FROM_1M(1_000_000L, null);

    private final long lowerBound;
    private final Long upperBound;

    PriceBucket(long lowerBound, Long upperBound) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public long getLowerBound() {
        return lowerBound;
    }

    /**
     * @return exclusive upper bound, or null for the open-ended top bucket
     */
    public Long getUpperBound() {
        return upperBound;
    }

    public boolean contains(long price) {
        return price >= lowerBound && (upperBound == null || price < upperBound);
    }

    public static Optional<PriceBucket> of(long price) {
        for (PriceBucket bucket : values()) {
            if (bucket.contains(price)) {
                return Optional.of(bucket);
            }
        }
        return Optional.empty();
    }
}
