package io.polychain.chains;

import static org.junit.jupiter.api.Assertions.*;

import io.polychain.chains.cosmos.CosmosImplementation;
import io.polychain.chains.cosmos.CosmosProvider;
import io.polychain.chains.stc.StcClient;
import io.polychain.chains.stc.StcImplementation;
import io.polychain.core.error.NoAvailableClientException;
import io.polychain.core.model.BalanceRequest;
import io.polychain.core.model.ChainInfo;
import io.polychain.core.model.ClientConfig;
import io.polychain.provider.ChainRegistry;
import io.polychain.provider.ChainSelector;
import io.polychain.provider.ProviderController;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChainsTest {

    private StubRpcNode syncing;
    private StubRpcNode healthy;
    private ProviderController controller;

    @BeforeEach
    void setUp() {
        syncing = new StubRpcNode().result("chain.info", "{\"head\":{\"number\":\"0\"}}");
        healthy = new StubRpcNode()
                .result("chain.info", "{\"head\":{\"number\":\"2048\"}}")
                .result("state.get_resource", "{\"json\":{\"token\":{\"value\":\"500\"}}}");

        List<ChainInfo> chains = List.of(
                new ChainInfo("STC", StcImplementation.ID, List.of(
                        ClientConfig.of("StcClient", syncing.url()),
                        ClientConfig.of("StcClient", healthy.url()))),
                new ChainInfo("ATOM", CosmosImplementation.ID,
                        List.of(ClientConfig.of("Tendermint", "http://127.0.0.1:1")),
                        Map.of("addressPrefix", "cosmos", "mainCoinDenom", "uatom")));
        controller = ProviderController.builder(Chains.defaultRegistry(), ChainSelector.of(chains))
                .readinessTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        controller.close();
        syncing.close();
        healthy.close();
    }

    @Test
    void defaultRegistryHoldsBundledModules() {
        ChainRegistry registry = Chains.defaultRegistry();

        assertEquals(Set.of("stc", "cosmos"), registry.ids());
        assertEquals(Set.of("StcClient"), registry.require("stc").clientFactories().keySet());
        assertEquals(Set.of("Tendermint"), registry.require("cosmos").clientFactories().keySet());
    }

    @Test
    void routesToTheReadyStarcoinNode() {
        List<BigInteger> balances = controller.getBalances("STC", List.of(BalanceRequest.of("0x01")));

        assertEquals(List.of(BigInteger.valueOf(500)), balances);
        assertInstanceOf(StcClient.class, controller.getClient("STC"));
        assertTrue(syncing.requests().size() <= 1);
        assertEquals(1, healthy.requests().stream().filter(r -> r.path("method").asText().equals("chain.info")).count());
    }

    @Test
    void unreachableGatewayMeansNoClient() {
        assertThrows(NoAvailableClientException.class, () -> controller.getInfo("ATOM"));
    }

    @Test
    void providerWorksWithoutNode() {
        assertInstanceOf(CosmosProvider.class, controller.getProvider("ATOM"));
        assertTrue(controller.verifyAddress("ATOM", "cosmos155svs6sgxe55rnvs6ghprtqu0mh69kehrn0dqr").valid());
        assertTrue(controller.verifyAddress("STC", "0xb61a35af603018441b06177a8820ff2a").valid());
    }

    @Test
    void clientFactoryRequiresUrl() {
        assertThrows(IllegalArgumentException.class,
                () -> new StcImplementation().clientFactories().get("StcClient").create(List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new CosmosImplementation().clientFactories().get("Tendermint").create(List.of(42)));
    }
}
