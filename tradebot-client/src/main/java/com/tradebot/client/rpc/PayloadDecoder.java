package com.tradebot.client.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Turns the {@code data} part of a response into a typed result.
 */
@FunctionalInterface
public interface PayloadDecoder<T> {

    T decode(ObjectMapper mapper, JsonNode data) throws IOException;
}
