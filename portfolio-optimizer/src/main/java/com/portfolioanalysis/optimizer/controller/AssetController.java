package com.portfolioanalysis.optimizer.controller;

import com.portfolioanalysis.optimizer.controller.dto.AssetInfoResponse;
import com.portfolioanalysis.optimizer.service.AssetInfoService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the ticker name catalog.
 */
@RestController
@RequestMapping("/assets")
@RequiredArgsConstructor
@Slf4j
public class AssetController {

    private final AssetInfoService assetInfoService;

    @GetMapping
    public ResponseEntity<List<AssetInfoResponse>> getCatalog() {
        log.debug("GET /assets");
        return ResponseEntity.ok(assetInfoService.getCatalog());
    }

    /**
     * Unknown tickers are answered with the bare symbol rather than 404.
     */
    @GetMapping("/{symbol}")
    public ResponseEntity<AssetInfoResponse> getAssetInfo(@PathVariable String symbol) {
        log.debug("GET /assets/{}", symbol);
        return ResponseEntity.ok(assetInfoService.getAssetInfo(symbol));
    }
}
