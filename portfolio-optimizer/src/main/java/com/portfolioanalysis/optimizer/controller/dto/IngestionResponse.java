package com.portfolioanalysis.optimizer.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a CSV price upload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionResponse {

    private String symbol;
    private int recordsInserted;
    private String message;
}
