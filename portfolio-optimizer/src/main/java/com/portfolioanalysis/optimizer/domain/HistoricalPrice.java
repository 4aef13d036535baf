package com.portfolioanalysis.optimizer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Entity holding one adjusted closing price of one symbol.
 */
@Entity
@Table(name = "historical_prices", uniqueConstraints = {
        @UniqueConstraint(name = "uk_price_symbol_date", columnNames = { "symbol", "date" })
}, indexes = {
        @Index(name = "idx_price_symbol_date", columnList = "symbol, date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalPrice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "adjusted_close", nullable = false, precision = 14, scale = 6)
    private BigDecimal adjustedClose;
}
