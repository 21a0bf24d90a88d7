package io.polychain.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChainInfoTest {

    @Test
    void optionsAreCopiedAndReadable() {
        Map<String, Object> options = new HashMap<>();
        options.put("addressPrefix", "cosmos");
        options.put("gasPriceStep", Map.of("normal", 110));
        options.put("decimals", "6");
        ChainInfo chain = new ChainInfo(
                "ATOM", "cosmos", List.of(ClientConfig.of("Tendermint", "https://lcd.example")), options);
        options.put("addressPrefix", "changed");

        assertEquals("cosmos", chain.stringOption("addressPrefix"));
        assertEquals(new BigDecimal("6"), chain.decimalOption("decimals"));
        assertEquals(110, chain.mapOption("gasPriceStep").get("normal"));
        assertTrue(chain.mapOption("missing").isEmpty());
        assertNull(chain.option("missing"));
    }

    @Test
    void nestedOptionsCannotChangeAfterBinding() {
        Map<String, Object> steps = new HashMap<>();
        steps.put("normal", 110);
        List<Object> denoms = new ArrayList<>(List.of("uatom"));
        Map<String, Object> options = new HashMap<>();
        options.put("gasPriceStep", steps);
        options.put("denoms", denoms);
        ChainInfo chain = new ChainInfo("ATOM", "cosmos", List.of(), options);

        steps.put("normal", 999);
        denoms.add("uosmo");

        Map<String, Object> bound = chain.mapOption("gasPriceStep");
        assertEquals(110, bound.get("normal"));
        assertThrows(UnsupportedOperationException.class, () -> bound.put("high", 1));
        assertEquals(List.of("uatom"), chain.option("denoms"));
        assertFalse(chain.mapOption("gasPriceStep").containsKey("high"));
    }

    @Test
    void nullOptionValuesAreAllowed() {
        Map<String, Object> options = new HashMap<>();
        options.put("chainId", null);

        ChainInfo chain = new ChainInfo("ATOM", "cosmos", List.of(), options);

        assertTrue(chain.implOptions().containsKey("chainId"));
        assertNull(chain.stringOption("chainId"));
    }

    @Test
    void rejectsMistypedOptions() {
        ChainInfo chain = new ChainInfo("ATOM", "cosmos", List.of(), Map.of("gasPriceStep", "high", "fee", "cheap"));

        assertThrows(IllegalArgumentException.class, () -> chain.mapOption("gasPriceStep"));
        assertThrows(IllegalArgumentException.class, () -> chain.decimalOption("fee"));
    }

    @Test
    void clientsDefaultToEmpty() {
        ChainInfo chain = new ChainInfo("STC", "stc", null);

        assertTrue(chain.clients().isEmpty());
        assertTrue(chain.implOptions().isEmpty());
    }
}
