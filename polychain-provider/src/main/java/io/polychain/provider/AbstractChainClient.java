package io.polychain.provider;

import io.polychain.core.model.ChainInfo;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Base class holding the chain binding of a {@link ChainClient}.
 */
public abstract class AbstractChainClient implements ChainClient {

    private volatile @Nullable ChainInfo chainInfo;

    @Override
    public synchronized void setChainInfo(final ChainInfo chainInfo) {
        Objects.requireNonNull(chainInfo, "chainInfo");
        final ChainInfo current = this.chainInfo;
        if (current != null && !current.equals(chainInfo)) {
            throw new IllegalStateException(
                    this + " is already bound to chain " + current.code() + ", cannot rebind to " + chainInfo.code());
        }
        this.chainInfo = chainInfo;
    }

    @Override
    public ChainInfo chainInfo() {
        final ChainInfo current = chainInfo;
        if (current == null) {
            throw new IllegalStateException(this + " is not bound to a chain");
        }
        return current;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
