package com.tradebot.client.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The stateless HTTP equivalent of a channel call.
 *
 * @param verb     GET, POST or DELETE
 * @param segments path segments below the base URL, unencoded
 * @param query    query parameters, unencoded
 * @param body     JSON request body, or null
 */
public record HttpRoute(String verb, List<String> segments, Map<String, String> query, Object body) {

    public static HttpRoute get(String... segments) {
        return new HttpRoute("GET", List.of(segments), Map.of(), null);
    }

    public static HttpRoute post(Object body, String... segments) {
        return new HttpRoute("POST", List.of(segments), Map.of(), body);
    }

    public static HttpRoute delete(String... segments) {
        return new HttpRoute("DELETE", List.of(segments), Map.of(), null);
    }

    public HttpRoute withQuery(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(query);
        merged.put(name, value);
        return new HttpRoute(verb, segments, merged, body);
    }

    public String path() {
        return "/" + String.join("/", segments);
    }

    @Override
    public String toString() {
        return verb + " " + path();
    }
}
