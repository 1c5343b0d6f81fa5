package com.keystone.core.gate;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Produces per-criterion quality scores for a structurally valid output.
 */
public interface QualityAssessor {

    record Assessment(Map<Criterion, Double> scores, List<String> findings) {
        public Assessment {
            scores = Map.copyOf(scores);
            findings = List.copyOf(findings);
        }
    }

    Assessment assess(JsonNode output, OutputSchema schema);
}
