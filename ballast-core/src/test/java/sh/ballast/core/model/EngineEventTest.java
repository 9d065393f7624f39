// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import sh.ballast.core.types.Address;

class EngineEventTest {

    private static final Address USER = new Address("0x" + "1".repeat(40));
    private static final Address TOKEN = new Address("0x" + "2".repeat(40));

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void serializesWithEventDiscriminator() throws Exception {
        EngineEvent event = new EngineEvent.CollateralDeposited(USER, TOKEN, BigInteger.TEN);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(event));

        assertEquals("CollateralDeposited", json.get("event").asText());
        assertEquals(USER.value(), json.get("user").asText());
        assertEquals(TOKEN.value(), json.get("token").asText());
        assertEquals(10, json.get("amount").asInt());
    }

    @Test
    void serializesHealthFactorsAsFixedPointNumbers() throws Exception {
        EngineEvent event = new EngineEvent.PositionLiquidated(
                USER, TOKEN, TOKEN, BigInteger.ONE, BigInteger.TWO,
                HealthFactor.ratio(BigInteger.valueOf(900)), HealthFactor.UNCONSTRAINED);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(event));

        assertEquals("PositionLiquidated", json.get("event").asText());
        assertEquals(BigInteger.valueOf(900), json.get("startingHealthFactor").bigIntegerValue());
        assertEquals(HealthFactor.UINT256_MAX, json.get("endingHealthFactor").bigIntegerValue());
    }

    @Test
    void rejectsMissingFields() {
        assertThrows(NullPointerException.class, () -> new EngineEvent.DebtMinted(null, BigInteger.ONE));
        assertThrows(NullPointerException.class,
                () -> new EngineEvent.CollateralRedeemed(USER, USER, TOKEN, null));
    }
}
