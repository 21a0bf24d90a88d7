package io.polychain.rpc;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * The {@code error} member of a JSON-RPC response. Accepts both the standard
 * {@code code}/{@code message} names and the {@code errorCode}/{@code errorMessage}
 * spelling used by some nodes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(
        @JsonAlias("errorCode") @Nullable Integer code,
        @JsonAlias("errorMessage") @Nullable String message,
        @Nullable JsonNode data) {}
