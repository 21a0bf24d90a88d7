package io.polychain.chains.cosmos;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.polychain.core.error.NotImplementedException;
import io.polychain.core.model.AddressInfo;
import io.polychain.core.model.AddressValidation;
import io.polychain.core.model.ChainInfo;
import io.polychain.core.model.FeePrice;
import io.polychain.core.model.FeePricePerUnit;
import io.polychain.core.model.TxInput;
import io.polychain.core.model.TxOutput;
import io.polychain.core.model.UnsignedTx;
import io.polychain.provider.ClientSelector;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CosmosProviderTest {

    private static final String FROM = "cosmos155svs6sgxe55rnvs6ghprtqu0mh69kehrn0dqr";
    private static final String OSMO = "osmo155svs6sgxe55rnvs6ghprtqu0mh69kehtguak3";

    private final ChainInfo chain = new ChainInfo(
            "ATOM", "cosmos", List.of(), Map.of("addressPrefix", "cosmos", "mainCoinDenom", "uatom"));
    private final Tendermint client = mock(Tendermint.class);
    private final ClientSelector selector = filter -> {
        assertTrue(filter.test(client));
        return client;
    };
    private final CosmosProvider provider = new CosmosProvider(chain, selector);

    @Test
    void verifyAddressRequiresConfiguredPrefix() {
        AddressValidation valid = provider.verifyAddress(FROM.toUpperCase());

        assertTrue(valid.valid());
        assertEquals(FROM, valid.normalizedAddress());
        assertFalse(provider.verifyAddress(OSMO).valid());
        assertFalse(provider.verifyAddress("cosmos1invalid").valid());
        verifyNoInteractions(client);
    }

    @Test
    void verifyAddressWithoutPrefixOptionFails() {
        CosmosProvider unconfigured = new CosmosProvider(new ChainInfo("ATOM", "cosmos", List.of()), selector);

        assertFalse(unconfigured.verifyAddress(FROM).valid());
    }

    @Test
    void buildFillsPriceNonceAndAccountNumber() {
        when(client.getFeePricePerUnit()).thenReturn(FeePricePerUnit.of(FeePrice.of(250)));
        when(client.getAddress(FROM)).thenReturn(new AddressInfo(BigInteger.TEN, true, 12L, 10010L));

        UnsignedTx built = provider.buildUnsignedTx(UnsignedTx.of(
                new TxInput(FROM, BigInteger.ONE, null), new TxOutput(OSMO, BigInteger.ONE, null)));

        assertEquals(BigDecimal.valueOf(250), built.feePricePerUnit());
        assertEquals(12L, built.nonce());
        assertEquals(10010L, built.payload().get("accountNumber"));
    }

    @Test
    void buildKeepsPresetValues() {
        UnsignedTx preset = UnsignedTx.of(new TxInput(FROM, BigInteger.ONE, null), new TxOutput(FROM, BigInteger.ONE, null))
                .withNonce(3L)
                .withFeePricePerUnit(BigDecimal.ONE)
                .withPayloadEntry("accountNumber", 1L);

        assertEquals(preset, provider.buildUnsignedTx(preset));
        verifyNoInteractions(client);
    }

    @Test
    void signingIsNotSupported() {
        assertThrows(NotImplementedException.class, () -> provider.signTransaction(
                UnsignedTx.of(new TxInput(FROM, BigInteger.ONE, null), new TxOutput(FROM, BigInteger.ONE, null)),
                Map.of()));
        assertThrows(NotImplementedException.class, () -> provider.signMessage("hi", null, FROM));
    }
}
