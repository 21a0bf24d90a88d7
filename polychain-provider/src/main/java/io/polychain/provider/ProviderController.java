package io.polychain.provider;

import io.polychain.core.DebugLogger;
import io.polychain.core.LogFormatter;
import io.polychain.core.crypto.Signer;
import io.polychain.core.crypto.Verifier;
import io.polychain.core.error.NoAvailableClientException;
import io.polychain.core.model.AddressInfo;
import io.polychain.core.model.AddressValidation;
import io.polychain.core.model.BalanceRequest;
import io.polychain.core.model.ChainInfo;
import io.polychain.core.model.ClientConfig;
import io.polychain.core.model.ClientInfo;
import io.polychain.core.model.FeePricePerUnit;
import io.polychain.core.model.PartialTokenInfo;
import io.polychain.core.model.SignedTx;
import io.polychain.core.model.TransactionStatus;
import io.polychain.core.model.UnsignedTx;
import io.polychain.core.model.Utxo;
import io.polychain.rpc.PolychainExecutors;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the library: resolves a ready client per chain and routes
 * every operation to the right client or provider.
 *
 * <p>
 * <strong>Client resolution</strong> ({@link #getClient(String, ClientFilter)}):
 * <ol>
 *   <li>A cached client that has not expired and passes the filter is returned
 *       without any network activity.</li>
 *   <li>Otherwise the candidate pool of the chain is built (once per chain code,
 *       unless it came out empty) from its {@link ClientConfig}s, and every
 *       filter-passing candidate is asked for {@link ChainClient#getInfo()}
 *       concurrently.</li>
 *   <li>The first candidate reporting {@code ready} wins and is cached for
 *       {@link ControllerConfig#cacheTtl()}. Candidates reporting not ready or
 *       failing are disqualified.</li>
 *   <li>When every candidate is disqualified or
 *       {@link ControllerConfig#readinessTimeout()} passes first,
 *       {@link NoAvailableClientException} is thrown.</li>
 * </ol>
 * Outstanding checks are cancelled once the race ends; the interrupt aborts
 * their HTTP exchanges.
 *
 * <pre>{@code
 * ProviderController controller = ProviderController.builder(Chains.defaultRegistry(), ChainSelector.of(chains))
 *         .readinessTimeout(Duration.ofSeconds(5))
 *         .build();
 * List<BigInteger> balances = controller.getBalances("stc", List.of(BalanceRequest.of(address)));
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> all methods may be called concurrently.
 * Two concurrent resolutions of the same chain may both race; the later
 * result replaces the earlier one in the cache.
 */
public final class ProviderController implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderController.class);

    private final ChainRegistry registry;
    private final ChainSelector chainSelector;
    private final ControllerConfig config;
    private final Clock clock;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private final Map<String, List<ChainClient>> pools = new ConcurrentHashMap<>();
    private final Map<String, CachedClient> cache = new ConcurrentHashMap<>();

    private ProviderController(final Builder builder) {
        this.registry = builder.registry;
        this.chainSelector = builder.chainSelector;
        this.config = new ControllerConfig(builder.readinessTimeout, builder.cacheTtl);
        this.clock = builder.clock;
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = PolychainExecutors.newIoBoundExecutor();
            this.ownsExecutor = true;
        }
    }

    public static Builder builder(final ChainRegistry registry, final ChainSelector chainSelector) {
        return new Builder(registry, chainSelector);
    }

    public ControllerConfig config() {
        return config;
    }

    public ChainClient getClient(final String chainCode) {
        return getClient(chainCode, null);
    }

    /**
     * Returns a ready client of the chain.
     *
     * @param chainCode the chain code
     * @param filter restricts eligible clients; {@code null} accepts any
     * @throws NoAvailableClientException if no eligible client becomes ready in time
     * @throws IllegalArgumentException if the chain code or its implementation is unknown
     */
    public ChainClient getClient(final String chainCode, final @Nullable ClientFilter filter) {
        final ClientFilter accept = filter == null ? ClientFilter.any() : filter;

        final CachedClient cached = cache.get(chainCode);
        final Instant now = clock.instant();
        if (cached != null && cached.isFresh(now) && accept.test(cached.client())) {
            DebugLogger.logProvider(() -> LogFormatter.formatCacheHit(
                    chainCode,
                    cached.client().toString(),
                    Duration.between(now, cached.expiresAt()).toMillis()));
            return cached.client();
        }

        final List<ChainClient> candidates = new ArrayList<>();
        for (final ChainClient client : pool(chainCode)) {
            if (accept.test(client)) {
                candidates.add(client);
            }
        }

        final long start = System.nanoTime();
        final ChainClient winner = race(chainCode, candidates);
        cache.put(chainCode, new CachedClient(winner, clock.instant().plus(config.cacheTtl())));
        final long elapsedMicros = (System.nanoTime() - start) / 1_000L;
        DebugLogger.logProvider(() -> LogFormatter.formatClientSelected(chainCode, winner.toString(), elapsedMicros));
        return winner;
    }

    /**
     * Returns a provider bound to the chain. No client is resolved until the
     * provider needs one.
     *
     * @throws IllegalArgumentException if the chain code or its implementation is unknown
     */
    public ChainProvider getProvider(final String chainCode) {
        final ChainInfo chainInfo = chainSelector.select(chainCode);
        final ChainImplementation implementation = registry.require(chainInfo.impl());
        return implementation.createProvider(chainInfo, filter -> getClient(chainCode, filter));
    }

    // --- client operations ---

    public ClientInfo getInfo(final String chainCode) {
        return getClient(chainCode).getInfo();
    }

    public List<@Nullable AddressInfo> getAddresses(final String chainCode, final List<String> addresses) {
        return getClient(chainCode).getAddresses(addresses);
    }

    public List<@Nullable BigInteger> getBalances(final String chainCode, final List<BalanceRequest> requests) {
        return getClient(chainCode).getBalances(requests);
    }

    public List<@Nullable TransactionStatus> getTransactionStatuses(final String chainCode, final List<String> txids) {
        return getClient(chainCode).getTransactionStatuses(txids);
    }

    public FeePricePerUnit getFeePricePerUnit(final String chainCode) {
        return getClient(chainCode).getFeePricePerUnit();
    }

    public boolean broadcastTransaction(final String chainCode, final String rawTx) {
        return getClient(chainCode).broadcastTransaction(rawTx);
    }

    public List<@Nullable PartialTokenInfo> getTokenInfos(final String chainCode, final List<String> tokenAddresses) {
        return getClient(chainCode).getTokenInfos(tokenAddresses);
    }

    public Map<String, List<Utxo>> getUtxos(final String chainCode, final List<String> addresses) {
        return getClient(chainCode).getUtxos(addresses);
    }

    // --- provider operations ---

    public UnsignedTx buildUnsignedTx(final String chainCode, final UnsignedTx unsignedTx) {
        return getProvider(chainCode).buildUnsignedTx(unsignedTx);
    }

    public String pubkeyToAddress(final String chainCode, final Verifier verifier, final @Nullable String encoding) {
        return getProvider(chainCode).pubkeyToAddress(verifier, encoding);
    }

    public SignedTx signTransaction(
            final String chainCode, final UnsignedTx unsignedTx, final Map<String, Signer> signers) {
        return getProvider(chainCode).signTransaction(unsignedTx, signers);
    }

    public AddressValidation verifyAddress(final String chainCode, final String address) {
        return getProvider(chainCode).verifyAddress(address);
    }

    public AddressValidation verifyTokenAddress(final String chainCode, final String address) {
        return getProvider(chainCode).verifyTokenAddress(address);
    }

    public String signMessage(
            final String chainCode, final String message, final Signer signer, final @Nullable String address) {
        return getProvider(chainCode).signMessage(message, signer, address);
    }

    public boolean verifyMessage(
            final String chainCode, final String address, final String message, final String signature) {
        return getProvider(chainCode).verifyMessage(address, message, signature);
    }

    /**
     * Forgets every resolved client and closes the pooled clients. Pools are
     * rebuilt on next use.
     */
    public void reset() {
        cache.clear();
        final List<List<ChainClient>> dropped = new ArrayList<>(pools.values());
        pools.clear();
        for (final List<ChainClient> pool : dropped) {
            for (final ChainClient client : pool) {
                try {
                    client.close();
                } catch (RuntimeException e) {
                    LOG.warn("Failed to close client {}", client, e);
                }
            }
        }
    }

    @Override
    public void close() {
        reset();
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private List<ChainClient> pool(final String chainCode) {
        final List<ChainClient> pool = pools.computeIfAbsent(chainCode, this::createPool);
        return pool == null ? List.of() : pool;
    }

    /**
     * Builds the candidate pool of a chain. An empty pool is not kept, so the
     * next resolution builds it again. If a factory fails, the clients built
     * so far are closed.
     */
    private @Nullable List<ChainClient> createPool(final String chainCode) {
        final ChainInfo chainInfo = chainSelector.select(chainCode);
        final ChainImplementation implementation = registry.require(chainInfo.impl());
        final Map<String, ClientFactory> factories = implementation.clientFactories();

        final List<ChainClient> clients = new ArrayList<>(chainInfo.clients().size());
        try {
            for (final ClientConfig clientConfig : chainInfo.clients()) {
                final ClientFactory factory = factories.get(clientConfig.name());
                if (factory == null) {
                    LOG.debug("Skipping unknown client {} of chain {} (known: {})",
                            clientConfig.name(), chainCode, factories.keySet());
                    continue;
                }
                final ChainClient client = factory.create(clientConfig.args());
                clients.add(client);
                client.setChainInfo(chainInfo);
            }
        } catch (RuntimeException e) {
            for (final ChainClient client : clients) {
                try {
                    client.close();
                } catch (RuntimeException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw e;
        }
        return clients.isEmpty() ? null : Collections.unmodifiableList(clients);
    }

    private ChainClient race(final String chainCode, final List<ChainClient> candidates) {
        if (candidates.isEmpty()) {
            return noClient(chainCode, 0, "no eligible candidates", null);
        }

        final ExecutorCompletionService<@Nullable ChainClient> completion = new ExecutorCompletionService<>(executor);
        final List<Future<@Nullable ChainClient>> futures = new ArrayList<>(candidates.size());
        for (final ChainClient candidate : candidates) {
            futures.add(completion.submit(() -> candidate.getInfo().ready() ? candidate : null));
        }

        final long deadline = System.nanoTime() + config.readinessTimeout().toNanos();
        Throwable lastFailure = null;
        int pending = futures.size();
        try {
            while (pending > 0) {
                final long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                final Future<@Nullable ChainClient> done = completion.poll(remaining, TimeUnit.NANOSECONDS);
                if (done == null) {
                    break;
                }
                pending--;
                try {
                    final ChainClient winner = done.get();
                    if (winner != null) {
                        return winner;
                    }
                    LOG.debug("Candidate of chain {} reported not ready", chainCode);
                } catch (ExecutionException e) {
                    lastFailure = e.getCause();
                    LOG.debug("Readiness check of chain {} failed: {}", chainCode, String.valueOf(lastFailure));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return noClient(chainCode, candidates.size(), "interrupted", e);
        } finally {
            for (final Future<@Nullable ChainClient> future : futures) {
                future.cancel(true);
            }
        }

        final String reason = pending > 0
                ? "timed out after " + config.readinessTimeout().toMillis() + "ms"
                : "all candidates disqualified";
        return noClient(chainCode, candidates.size(), reason, lastFailure);
    }

    private static ChainClient noClient(
            final String chainCode, final int candidates, final String reason, final @Nullable Throwable cause) {
        DebugLogger.logProvider(() -> LogFormatter.formatNoClient(chainCode, candidates, reason));
        LOG.warn("No available client for chain {} ({} candidates, {})", chainCode, candidates, reason);
        throw new NoAvailableClientException(chainCode, cause);
    }

    public static final class Builder {
        private final ChainRegistry registry;
        private final ChainSelector chainSelector;
        private Duration readinessTimeout = ControllerConfig.DEFAULT_READINESS_TIMEOUT;
        private Duration cacheTtl = ControllerConfig.DEFAULT_CACHE_TTL;
        private Clock clock = Clock.systemUTC();
        private @Nullable ExecutorService executor;

        private Builder(final ChainRegistry registry, final ChainSelector chainSelector) {
            this.registry = Objects.requireNonNull(registry, "registry");
            this.chainSelector = Objects.requireNonNull(chainSelector, "chainSelector");
        }

        public Builder config(final ControllerConfig config) {
            this.readinessTimeout = config.readinessTimeout();
            this.cacheTtl = config.cacheTtl();
            return this;
        }

        public Builder readinessTimeout(final Duration readinessTimeout) {
            this.readinessTimeout = Objects.requireNonNull(readinessTimeout, "readinessTimeout");
            return this;
        }

        public Builder cacheTtl(final Duration cacheTtl) {
            this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Runs readiness checks on the given executor. The controller does not
         * shut it down on {@link ProviderController#close()}.
         */
        public Builder executor(final ExecutorService executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public ProviderController build() {
            return new ProviderController(this);
        }
    }
}
