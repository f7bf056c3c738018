package com.questrail.bridge.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.api.BridgeClient;
import com.questrail.bridge.error.BridgeProtocolException;
import com.questrail.bridge.protocol.BridgeMessageCodec;
import com.questrail.bridge.protocol.BridgeResponse;
import com.questrail.bridge.protocol.MessageKind;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Shared envelope handling for the domain operation groups.
 *
 * <p>Every operation is the same three steps: build a payload carrying an
 * {@code action}, send it through the client, read one field of
 * {@code data} from the response. A failed response without remote error
 * text is reported with the operation's own message.</p>
 */
abstract class OperationSupport
{
    @FunctionalInterface
    interface ResponseReader<T>
    {
        T read(BridgeResponse response);
    }

    private final BridgeClient client;
    private final BridgeMessageCodec codec;
    private final MessageKind kind;

    OperationSupport(BridgeClient client, BridgeMessageCodec codec, MessageKind kind)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    final ObjectNode payload(String action)
    {
        ObjectNode payload = codec.newPayload();
        if (action != null) {
            payload.put("action", action);
        }
        return payload;
    }

    final JsonNode tree(Object value)
    {
        return codec.toTree(value);
    }

    final <T> CompletableFuture<T> call(String targetId,
                                        ObjectNode payload,
                                        String failureMessage,
                                        ResponseReader<T> reader)
    {
        return client.send(kind, targetId, payload).handle((response, failure) -> {
            if (failure != null) {
                throw asCompletionFailure(failure, failureMessage);
            }
            return reader.read(response);
        });
    }

    final CompletableFuture<Void> run(String targetId, ObjectNode payload, String failureMessage)
    {
        return call(targetId, payload, failureMessage, response -> null);
    }

    final <T> ResponseReader<T> field(String name, Class<T> type)
    {
        return response -> read(response, name, node -> codec.convert(node, type));
    }

    final <T> ResponseReader<T> field(String name, TypeReference<T> type)
    {
        return response -> read(response, name, node -> codec.convert(node, type));
    }

    private static <T> T read(BridgeResponse response, String name, Function<JsonNode, T> mapper)
    {
        JsonNode node = response.dataField(name);
        if (node.isMissingNode() || node.isNull()) {
            throw new BridgeProtocolException(response.correlationId(), null,
                    "Response is missing '" + name + "'");
        }
        try {
            return mapper.apply(node);
        } catch (IllegalArgumentException e) {
            throw new BridgeProtocolException(response.correlationId(),
                    "Response field '" + name + "' has an unexpected shape", e);
        }
    }

    private static RuntimeException asCompletionFailure(Throwable failure, String failureMessage)
    {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;

        if (cause instanceof BridgeProtocolException protocol && protocol.remoteError().isEmpty()
                && protocol.getCause() == null) {
            return new BridgeProtocolException(protocol.correlationId(), null, failureMessage);
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new CompletionException(cause);
    }
}
