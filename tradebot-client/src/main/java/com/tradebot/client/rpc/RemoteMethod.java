package com.tradebot.client.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * A named remote operation together with the decoder for its result.
 *
 * The same decoder reads the channel response {@code data} and the HTTP
 * fallback body, which share one shape.
 *
 * @param name    method name sent on the channel
 * @param decoder result decoder
 */
public record RemoteMethod<T>(String name, PayloadDecoder<T> decoder) {

    public static <T> RemoteMethod<T> of(String name, Class<T> type) {
        return new RemoteMethod<>(name, (mapper, data) -> mapper.treeToValue(data, type));
    }

    public static <T> RemoteMethod<T> of(String name, TypeReference<T> type) {
        return new RemoteMethod<>(name, (mapper, data) -> mapper.readerFor(type).readValue(data));
    }

    /**
     * A method whose result carries no information for the caller.
     */
    public static RemoteMethod<Void> noResult(String name) {
        return new RemoteMethod<>(name, (mapper, data) -> null);
    }

    public T decode(ObjectMapper mapper, JsonNode data) throws IOException {
        return decoder.decode(mapper, data);
    }
}
