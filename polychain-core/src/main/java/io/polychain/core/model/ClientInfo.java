package io.polychain.core.model;

/**
 * Health snapshot reported by a node client.
 *
 * @param bestBlockNumber the latest block height the node knows about
 * @param ready whether the node is synced and fit to serve requests
 */
public record ClientInfo(long bestBlockNumber, boolean ready) {}
