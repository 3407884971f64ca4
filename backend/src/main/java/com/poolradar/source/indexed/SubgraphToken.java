package com.poolradar.source.indexed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Token object as returned by the indexed service; numeric fields arrive as strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubgraphToken(String id, String symbol, String name, String decimals) {
}
