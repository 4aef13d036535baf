package com.portfolioanalysis.optimizer.repository;

import com.portfolioanalysis.optimizer.domain.HistoricalPrice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for adjusted closing prices.
 */
@Repository
public interface HistoricalPriceRepository extends JpaRepository<HistoricalPrice, Long> {

    /**
     * Find prices for a symbol within a date range, ordered by date.
     */
    @Query("SELECT h FROM HistoricalPrice h WHERE h.symbol = :symbol " +
            "AND h.date >= :startDate AND h.date <= :endDate ORDER BY h.date ASC")
    List<HistoricalPrice> findBySymbolAndDateRange(
            @Param("symbol") String symbol,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);

    @Query("SELECT h.date FROM HistoricalPrice h WHERE h.symbol = :symbol")
    List<LocalDate> findDatesBySymbol(@Param("symbol") String symbol);

    long countBySymbol(String symbol);

    @Modifying
    @Query("DELETE FROM HistoricalPrice h WHERE h.symbol = :symbol")
    int deleteBySymbol(@Param("symbol") String symbol);
}
