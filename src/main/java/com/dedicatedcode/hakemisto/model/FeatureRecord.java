package com.dedicatedcode.hakemisto.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Serving record of a geocoded feature as stored in the feature index.
 */
public record FeatureRecord(
        @JsonProperty("id") FeatureId id,
        @JsonProperty("name") String name,
        @JsonProperty("featureType") String featureType,
        @JsonProperty("lat") double lat,
        @JsonProperty("lon") double lon,
        @JsonProperty("names") Map<String, String> names, // lang -> name
        @JsonProperty("population") long population
) {
}
