package io.polychain.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a JSON-RPC response carries an {@code error} member.
 *
 * <p>
 * The error takes priority over any {@code result} present in the same
 * response. Nodes disagree on the shape of the error object, so both the
 * standard {@code code}/{@code message} and the {@code errorCode}/{@code errorMessage}
 * spellings are accepted; either may be missing, hence the nullable code.
 *
 * <p>
 * <strong>Common Standard Error Codes:</strong>
 * <ul>
 * <li><strong>-32700</strong>: Parse error</li>
 * <li><strong>-32600</strong>: Invalid request</li>
 * <li><strong>-32601</strong>: Method not found</li>
 * <li><strong>-32602</strong>: Invalid params</li>
 * <li><strong>-32603</strong>: Internal error</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class JsonRpcException extends ProtocolException {

    private final @Nullable Integer code;
    private final @Nullable String remoteMessage;
    private final @Nullable String data;

    public JsonRpcException(final @Nullable Integer code, final @Nullable String remoteMessage, final @Nullable String data) {
        super(buildMessage(code, remoteMessage), null, null);
        this.code = code;
        this.remoteMessage = remoteMessage;
        this.data = data;
    }

    public @Nullable Integer code() {
        return code;
    }

    public @Nullable String remoteMessage() {
        return remoteMessage;
    }

    public @Nullable String data() {
        return data;
    }

    @Override
    public String toString() {
        return "JsonRpcException{"
                + "code="
                + code
                + ", message="
                + remoteMessage
                + ", data="
                + data
                + "}";
    }

    private static String buildMessage(final @Nullable Integer code, final @Nullable String remoteMessage) {
        return "Error JSON RPC response<" + code + ">: " + remoteMessage;
    }
}
