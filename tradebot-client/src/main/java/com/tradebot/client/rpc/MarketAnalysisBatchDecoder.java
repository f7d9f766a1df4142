package com.tradebot.client.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradebot.core.model.MarketAnalysis;
import com.tradebot.core.model.MarketAnalysisBatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a batch analysis result into one analysis list per requested symbol.
 *
 * Accepted shapes:
 * - {@code [[...], [...]]}
 * - {@code [{analysis: [...]}, ...]}
 * - {@code {results: [{analysis: [...]}, ...]}}
 *
 * Entries without analysis become empty lists.
 */
public class MarketAnalysisBatchDecoder implements PayloadDecoder<List<List<MarketAnalysis>>> {
    private static final Logger LOG = LoggerFactory.getLogger(MarketAnalysisBatchDecoder.class);
    private static final TypeReference<List<MarketAnalysis>> ANALYSIS_LIST = new TypeReference<>() {};

    @Override
    public List<List<MarketAnalysis>> decode(ObjectMapper mapper, JsonNode data) throws IOException {
        JsonNode entries;
        if (data != null && data.isArray()) {
            entries = data;
        } else if (data != null && data.path("results").isArray()) {
            entries = data.get("results");
        } else {
            LOG.warn("Unexpected batch analysis shape: {}", data);
            return List.of();
        }

        List<List<MarketAnalysis>> out = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            if (entry.isArray()) {
                out.add(mapper.readerFor(ANALYSIS_LIST).readValue(entry));
            } else if (entry.isObject()) {
                MarketAnalysisBatchResult result = mapper.treeToValue(entry, MarketAnalysisBatchResult.class);
                if (!result.success() && result.error() != null) {
                    LOG.debug("Batch analysis failed for {}: {}", result.symbol(), result.error());
                }
                out.add(result.analysisOrEmpty());
            } else {
                out.add(List.of());
            }
        }
        return out;
    }
}
