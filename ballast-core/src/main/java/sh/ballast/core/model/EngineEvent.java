// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.model;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import sh.ballast.core.types.Address;

/**
 * Events emitted by the engine once an operation has committed.
 * <p>
 * Events from an operation that fails are discarded together with its ledger changes.
 *
 * @since 0.1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "event")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EngineEvent.CollateralDeposited.class, name = "CollateralDeposited"),
        @JsonSubTypes.Type(value = EngineEvent.CollateralRedeemed.class, name = "CollateralRedeemed"),
        @JsonSubTypes.Type(value = EngineEvent.DebtMinted.class, name = "DebtMinted"),
        @JsonSubTypes.Type(value = EngineEvent.DebtBurned.class, name = "DebtBurned"),
        @JsonSubTypes.Type(value = EngineEvent.PositionLiquidated.class, name = "PositionLiquidated")
})
public sealed interface EngineEvent {

    /**
     * Collateral moved from a user into custody.
     */
    record CollateralDeposited(Address user, Address token, BigInteger amount) implements EngineEvent {
        public CollateralDeposited {
            Objects.requireNonNull(user, "user");
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(amount, "amount");
        }
    }

    /**
     * Collateral released from {@code from}'s balance to {@code to}.
     * {@code from} and {@code to} differ only for liquidation seizures.
     */
    record CollateralRedeemed(Address from, Address to, Address token, BigInteger amount) implements EngineEvent {
        public CollateralRedeemed {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(amount, "amount");
        }
    }

    record DebtMinted(Address user, BigInteger amount) implements EngineEvent {
        public DebtMinted {
            Objects.requireNonNull(user, "user");
            Objects.requireNonNull(amount, "amount");
        }
    }

    record DebtBurned(Address onBehalfOf, Address payer, BigInteger amount) implements EngineEvent {
        public DebtBurned {
            Objects.requireNonNull(onBehalfOf, "onBehalfOf");
            Objects.requireNonNull(payer, "payer");
            Objects.requireNonNull(amount, "amount");
        }
    }

    record PositionLiquidated(
            Address target,
            Address liquidator,
            Address token,
            BigInteger debtCovered,
            BigInteger collateralSeized,
            HealthFactor startingHealthFactor,
            HealthFactor endingHealthFactor) implements EngineEvent {
        public PositionLiquidated {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(liquidator, "liquidator");
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(debtCovered, "debtCovered");
            Objects.requireNonNull(collateralSeized, "collateralSeized");
            Objects.requireNonNull(startingHealthFactor, "startingHealthFactor");
            Objects.requireNonNull(endingHealthFactor, "endingHealthFactor");
        }
    }
}
