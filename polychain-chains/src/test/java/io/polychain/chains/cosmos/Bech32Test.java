package io.polychain.chains.cosmos;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class Bech32Test {

    private static final String ADDRESS = "cosmos155svs6sgxe55rnvs6ghprtqu0mh69kehrn0dqr";

    @Test
    void decodesCosmosAddress() {
        Bech32.Decoded decoded = Bech32.decode(ADDRESS);

        assertNotNull(decoded);
        assertEquals("cosmos", decoded.hrp());
        assertEquals(20, decoded.data().length);
        assertEquals(ADDRESS, Bech32.encode(decoded.hrp(), decoded.data()));
    }

    @Test
    void sameKeyUnderAnotherPrefix() {
        Bech32.Decoded decoded = Bech32.decode(ADDRESS);

        assertEquals("osmo155svs6sgxe55rnvs6ghprtqu0mh69kehtguak3", Bech32.encode("osmo", decoded.data()));
    }

    @Test
    void upperCaseIsAccepted() {
        assertNotNull(Bech32.decode(ADDRESS.toUpperCase()));
    }

    @Test
    void rejectsInvalidInput() {
        assertNull(Bech32.decode("cosmos155svs6sgxe55rnvs6ghprtqu0mh69kehrn0dqq"));
        assertNull(Bech32.decode("Cosmos155svs6sgxe55rnvs6ghprtqu0mh69kehrn0dqr"));
        assertNull(Bech32.decode("cosmos1b55svs6sgxe55rnvs6ghprtqu0mh69kehrn0dqr"));
        assertNull(Bech32.decode("nohrpseparator"));
        assertNull(Bech32.decode(""));
    }
}
