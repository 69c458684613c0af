package com.dedicatedcode.hakemisto.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One feature registered under an S2 cell of the reverse geocode index.
 *
 * @param featureId   feature the cell was generated for
 * @param featureType type of the feature, e.g. "city" or "admin2"
 * @param full        true if the cell lies completely inside the feature
 * @param wkbGeometry the feature's shape clipped to the cell, may be null
 */
public record CellGeometry(
        @JsonProperty("featureId") FeatureId featureId,
        @JsonProperty("featureType") String featureType,
        @JsonProperty("full") boolean full,
        @JsonProperty("wkbGeometry") byte[] wkbGeometry
) {
}
