package com.portfolioanalysis.optimizer.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog entry for a ticker.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssetInfoResponse {

    private String symbol;

    // The symbol itself when the catalog has no entry
    private String fullName;

    // "TICKER - Full Name", or the bare ticker when unknown
    private String displayName;

    private boolean known;
}
