package io.polychain.chains.cosmos;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.polychain.core.error.TransportException;
import io.polychain.core.model.AddressInfo;
import io.polychain.core.model.ChainInfo;
import io.polychain.core.model.CoinInfo;
import io.polychain.core.model.FeePrice;
import io.polychain.core.model.FeePricePerUnit;
import io.polychain.core.model.TransactionStatus;
import io.polychain.provider.BatchFanOut;
import io.polychain.provider.FanOutListener;
import io.polychain.rpc.RestfulClient;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TendermintTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ADDRESS = "cosmos155svs6sgxe55rnvs6ghprtqu0mh69kehrn0dqr";
    private static final Instant BLOCK_TIME = Instant.parse("2021-12-08T06:03:30Z");

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @Mock
    private RestfulClient rest;

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void readyWhileLatestBlockIsRecent() {
        when(rest.get("/cosmos/base/tendermint/v1beta1/blocks/latest")).thenReturn(json("""
                {"block":{"header":{"height":"8621972","time":"2021-12-08T06:03:30.000000000Z"}}}
                """));

        assertTrue(tendermintAt(BLOCK_TIME).getInfo().ready());
        assertEquals(8621972L, tendermintAt(BLOCK_TIME).getInfo().bestBlockNumber());
        assertTrue(tendermintAt(BLOCK_TIME.plusSeconds(30)).getInfo().ready());
        assertTrue(tendermintAt(BLOCK_TIME.plusSeconds(120)).getInfo().ready());
        assertFalse(tendermintAt(BLOCK_TIME.plusSeconds(121)).getInfo().ready());
        assertFalse(tendermintAt(BLOCK_TIME.minusSeconds(209)).getInfo().ready());
    }

    @Test
    void addressCombinesAccountAndBalance() {
        when(rest.get("/cosmos/auth/v1beta1/accounts/" + ADDRESS)).thenReturn(json("""
                {"account":{"@type":"/cosmos.auth.v1beta1.BaseAccount","account_number":"10010","sequence":"1"}}
                """));
        when(rest.get("/cosmos/bank/v1beta1/balances/" + ADDRESS)).thenReturn(balances());

        AddressInfo info = tendermint().getAddress(ADDRESS);

        assertEquals(new AddressInfo(BigInteger.valueOf(101122), true, 1L, 10010L), info);
        InOrder order = inOrder(rest);
        order.verify(rest).get("/cosmos/auth/v1beta1/accounts/" + ADDRESS);
        order.verify(rest).get("/cosmos/bank/v1beta1/balances/" + ADDRESS);
    }

    @Test
    void vestingAccountReadsBaseAccount() {
        when(rest.get("/cosmos/auth/v1beta1/accounts/" + ADDRESS)).thenReturn(json("""
                {"account":{"base_vesting_account":{},"base_account":{"account_number":"7","sequence":"3"}}}
                """));
        when(rest.get("/cosmos/bank/v1beta1/balances/" + ADDRESS)).thenReturn(balances());

        AddressInfo info = tendermint().getAddress(ADDRESS);

        assertEquals(3L, info.nonce());
        assertEquals(7L, info.accountNumber());
    }

    @Test
    void missingAccountIsNotExisting() {
        when(rest.get("/cosmos/auth/v1beta1/accounts/" + ADDRESS))
                .thenThrow(TransportException.wrongResponse(404, "{\"code\":5}"));

        assertEquals(new AddressInfo(BigInteger.ZERO, false, 0L, null), tendermint().getAddress(ADDRESS));
    }

    @Test
    void otherAccountFailuresPropagate() {
        when(rest.get("/cosmos/auth/v1beta1/accounts/" + ADDRESS))
                .thenThrow(TransportException.wrongResponse(500, ""));

        assertThrows(TransportException.class, () -> tendermint().getAddress(ADDRESS));
    }

    @Test
    void balancePicksDenom() {
        when(rest.get("/cosmos/bank/v1beta1/balances/" + ADDRESS)).thenReturn(balances());
        Tendermint tendermint = tendermint();

        assertEquals(BigInteger.valueOf(101122), tendermint.getBalance(ADDRESS, CoinInfo.token("uatom")));
        assertEquals(BigInteger.valueOf(11), tendermint.getBalance(ADDRESS, CoinInfo.token("uatom2")));
        assertEquals(BigInteger.valueOf(101122), tendermint.getBalance(ADDRESS, CoinInfo.mainCoin()));
        assertEquals(BigInteger.ZERO, tendermint.getBalance(ADDRESS, CoinInfo.token("ibc/27394FB0")));
    }

    @Test
    void transactionStatus() {
        when(rest.get("/cosmos/tx/v1beta1/txs/OK")).thenReturn(json("{\"tx_response\":{\"code\":0}}"));
        when(rest.get("/cosmos/tx/v1beta1/txs/FAILED")).thenReturn(json("{\"tx_response\":{\"code\":5}}"));
        when(rest.get("/cosmos/tx/v1beta1/txs/PENDING")).thenReturn(json("{\"tx\":{}}"));
        when(rest.get("/cosmos/tx/v1beta1/txs/UNKNOWN")).thenThrow(TransportException.wrongResponse(404, ""));
        when(rest.get("/cosmos/tx/v1beta1/txs/BAD")).thenThrow(TransportException.wrongResponse(400, ""));

        List<TransactionStatus> statuses =
                tendermint().getTransactionStatuses(List.of("OK", "FAILED", "PENDING", "UNKNOWN", "BAD"));

        assertEquals(List.of(
                TransactionStatus.CONFIRM_AND_SUCCESS,
                TransactionStatus.CONFIRM_BUT_FAILED,
                TransactionStatus.PENDING,
                TransactionStatus.NOT_FOUND,
                TransactionStatus.NOT_FOUND), statuses);
    }

    @Test
    void defaultFeeSteps() {
        assertEquals(
                new FeePricePerUnit(FeePrice.of(250), List.of(FeePrice.of(100), FeePrice.of(400))),
                tendermint().getFeePricePerUnit());
    }

    @Test
    void customFeeStepsOmitMissingLevels() {
        Tendermint tendermint = tendermint(Map.of(
                "addressPrefix", "cosmos",
                "mainCoinDenom", "uatom",
                "gasPriceStep", Map.of("normal", 110, "high", 777)));

        assertEquals(
                new FeePricePerUnit(FeePrice.of(110), List.of(FeePrice.of(777))),
                tendermint.getFeePricePerUnit());
    }

    @Test
    void broadcastSucceedsWithTxhashAndZeroCode() {
        when(rest.post(eq("/cosmos/tx/v1beta1/txs"), any(), isNull(), eq(400)))
                .thenReturn(json("{\"tx_response\":{\"txhash\":\"E3F1\",\"code\":0}}"));

        assertTrue(tendermint().broadcastTransaction("CpIBCo8B"));

        ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
        verify(rest).post(eq("/cosmos/tx/v1beta1/txs"), body.capture(), isNull(), eq(400));
        assertEquals(Map.of("mode", 2, "tx_bytes", "CpIBCo8B"), body.getValue());
    }

    @Test
    void broadcastRejected() {
        when(rest.post(eq("/cosmos/tx/v1beta1/txs"), any(), isNull(), eq(400)))
                .thenReturn(json("{\"tx_response\":{\"txhash\":\"E3F1\",\"code\":32,\"raw_log\":\"account sequence mismatch\"}}"))
                .thenReturn(json("{\"code\":3,\"message\":\"invalid tx\"}"));

        Tendermint tendermint = tendermint();
        assertFalse(tendermint.broadcastTransaction("CpIBCo8B"));
        assertFalse(tendermint.broadcastTransaction("CpIBCo8B"));
    }

    private Tendermint tendermint() {
        return tendermintAt(BLOCK_TIME);
    }

    private Tendermint tendermintAt(final Instant now) {
        return bind(new Tendermint(rest, Clock.fixed(now, ZoneOffset.UTC), fanOut()),
                Map.of("addressPrefix", "cosmos", "mainCoinDenom", "uatom", "chainId", "cosmoshub-4"));
    }

    private Tendermint tendermint(final Map<String, Object> options) {
        return bind(new Tendermint(rest, Clock.fixed(BLOCK_TIME, ZoneOffset.UTC), fanOut()), options);
    }

    private BatchFanOut fanOut() {
        return new BatchFanOut(executor, FanOutListener.logging());
    }

    private static Tendermint bind(final Tendermint tendermint, final Map<String, Object> options) {
        tendermint.setChainInfo(new ChainInfo("ATOM", "cosmos", List.of(), options));
        return tendermint;
    }

    private static JsonNode balances() {
        return json("""
                {"balances":[{"denom":"uatom","amount":"101122"},{"denom":"uatom2","amount":"11"}]}
                """);
    }

    private static JsonNode json(final String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }
}
