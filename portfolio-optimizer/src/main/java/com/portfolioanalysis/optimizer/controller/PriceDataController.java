package com.portfolioanalysis.optimizer.controller;

import com.portfolioanalysis.optimizer.controller.dto.IngestionResponse;
import com.portfolioanalysis.optimizer.service.PriceIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Locale;

/**
 * REST controller for loading and removing stored price history.
 */
@RestController
@RequestMapping("/prices")
@RequiredArgsConstructor
@Slf4j
public class PriceDataController {

    private final PriceIngestionService ingestionService;

    /**
     * Upload a Yahoo-style CSV of daily prices for a symbol.
     */
    @PostMapping(value = "/{symbol}", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<IngestionResponse> ingestPrices(
            @PathVariable String symbol,
            @RequestBody String csvContent) throws IOException {

        log.info("POST /prices/{} - {} bytes", symbol, csvContent.length());

        int inserted = ingestionService.ingestCsv(symbol, csvContent);

        IngestionResponse response = IngestionResponse.builder()
                .symbol(symbol.trim().toUpperCase(Locale.ROOT))
                .recordsInserted(inserted)
                .message("Ingested " + inserted + " price records")
                .build();

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{symbol}")
    public ResponseEntity<Void> deletePrices(@PathVariable String symbol) {

        log.info("DELETE /prices/{}", symbol);

        ingestionService.deleteSymbolData(symbol);

        return ResponseEntity.noContent().build();
    }
}
