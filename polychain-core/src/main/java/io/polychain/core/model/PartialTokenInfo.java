package io.polychain.core.model;

/**
 * Token metadata as reported by a node.
 */
public record PartialTokenInfo(String symbol, String name, int decimals) {}
