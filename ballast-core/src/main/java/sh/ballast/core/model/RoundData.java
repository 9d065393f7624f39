// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A single price-feed reading as returned by {@code latestRoundData()}.
 *
 * @param roundId         the round this reading belongs to
 * @param answer          the reported price, signed, in feed units
 * @param startedAt       epoch seconds at which the round started
 * @param updatedAt       epoch seconds of the last update, {@code 0} if the round never answered
 * @param answeredInRound the round in which the answer was computed
 * @since 0.1.0
 */
public record RoundData(
        BigInteger roundId,
        BigInteger answer,
        long startedAt,
        long updatedAt,
        BigInteger answeredInRound
) {

    public RoundData {
        Objects.requireNonNull(roundId, "roundId cannot be null");
        Objects.requireNonNull(answer, "answer cannot be null");
        Objects.requireNonNull(answeredInRound, "answeredInRound cannot be null");
    }
}
