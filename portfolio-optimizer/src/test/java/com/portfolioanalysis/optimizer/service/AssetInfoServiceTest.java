package com.portfolioanalysis.optimizer.service;

import com.portfolioanalysis.optimizer.config.AssetCatalogProperties;
import com.portfolioanalysis.optimizer.controller.dto.AssetInfoResponse;
import com.portfolioanalysis.optimizer.controller.dto.AssetSummaryResponse;
import com.portfolioanalysis.optimizer.domain.PriceTable;
import com.portfolioanalysis.optimizer.domain.PriceTableFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the ticker catalog and per-asset summaries.
 */
class AssetInfoServiceTest {

    private AssetInfoService assetInfoService;

    @BeforeEach
    void setUp() {
        AssetCatalogProperties properties = new AssetCatalogProperties();
        properties.getNames().put("AAPL", "Apple Inc. (Technology)");
        properties.getNames().put("gld", " SPDR Gold Shares ETF (Gold) ");
        properties.getNames().put("EMPTY", "  ");
        assetInfoService = new AssetInfoService(properties);
    }

    @Test
    void testGetFullName_KnownAndUnknown() {
        assertEquals("Apple Inc. (Technology)", assetInfoService.getFullName("aapl"));
        assertEquals("ZZZ", assetInfoService.getFullName(" zzz "));
    }

    @Test
    void testGetDisplayName_KnownAndUnknown() {
        assertEquals("GLD - SPDR Gold Shares ETF (Gold)", assetInfoService.getDisplayName("GLD"));
        assertEquals("EMPTY", assetInfoService.getDisplayName("EMPTY"));
    }

    @Test
    void testGetAssetInfo_UnknownSymbol() {
        AssetInfoResponse info = assetInfoService.getAssetInfo("xyz");

        assertEquals("XYZ", info.getSymbol());
        assertEquals("XYZ", info.getFullName());
        assertFalse(info.isKnown());
    }

    @Test
    void testGetAssetInfo_BlankSymbol() {
        assertThrows(IllegalArgumentException.class, () -> assetInfoService.getAssetInfo(" "));
    }

    @Test
    void testGetCatalog_SkipsBlankNames() {
        List<AssetInfoResponse> catalog = assetInfoService.getCatalog();

        assertEquals(List.of("AAPL", "GLD"), catalog.stream().map(AssetInfoResponse::getSymbol).toList());
        assertTrue(catalog.stream().allMatch(AssetInfoResponse::isKnown));
    }

    @Test
    void testSummarize_FirstAndLatestPrices() {
        // Arrange
        PriceTable table = new PriceTable(PriceTableFixtures.dates(3), List.of("AAPL", "FREE"),
                new double[][]{{100.0, 0.0}, {110.0, 1.0}, {125.0, 2.0}});

        // Act
        List<AssetSummaryResponse> summaries = assetInfoService.summarize(table);

        // Assert
        AssetSummaryResponse apple = summaries.get(0);
        assertEquals("AAPL - Apple Inc. (Technology)", apple.getDisplayName());
        assertEquals(100.0, apple.getFirstPrice());
        assertEquals(125.0, apple.getLatestPrice());
        assertEquals(0.25, apple.getTotalReturn(), 1e-12);
        assertEquals(3, apple.getDataPoints());
        assertEquals(PriceTableFixtures.START_DATE, apple.getStartDate());
        assertEquals(PriceTableFixtures.START_DATE.plusDays(2), apple.getEndDate());
        assertNull(summaries.get(1).getTotalReturn());
    }

    @Test
    void testSummarize_EmptyTable() {
        PriceTable empty = new PriceTable(List.of(), List.of(), new double[0][]);

        assertTrue(assetInfoService.summarize(empty).isEmpty());
    }
}
