package com.pairguard.hft.execution.model;

import com.pairguard.hft.domain.Outcome;
import lombok.NonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * An up/down market: one token per outcome and a fixed expiry.
 */
public record PairedMarket(
        @NonNull String marketId,
        @NonNull String asset,
        @NonNull String upTokenId,
        @NonNull String downTokenId,
        @NonNull Instant endTime
) {

    public MarketKey key() {
        return MarketKey.of(marketId, asset);
    }

    public String tokenFor(Outcome outcome) {
        return outcome == Outcome.UP ? upTokenId : downTokenId;
    }

    public Optional<Outcome> outcomeOf(String tokenId) {
        if (upTokenId.equals(tokenId)) return Optional.of(Outcome.UP);
        if (downTokenId.equals(tokenId)) return Optional.of(Outcome.DOWN);
        return Optional.empty();
    }

    public long secondsRemaining(Instant now) {
        return Duration.between(now, endTime).getSeconds();
    }
}
