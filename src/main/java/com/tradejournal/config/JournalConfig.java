package com.tradejournal.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for broker export ingestion and the trade log.
 *
 * <p>Broker exports are read from {@code {tradeReviewPath}/YYYY/MM/YYYY-MM-DD/}. Daily YAML logs are
 * written to {@code tradeLogDirectory}. Properties are read from the {@code tradejournal.journal} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "tradejournal.journal")
@Getter
@Setter
public class JournalConfig {

    /** Base directory of the broker's daily export folders. */
    private String tradeReviewPath = "data/trade-review";

    /** Directory holding one {@code YYYY-MM-DD.yaml} log per trading day. */
    private String tradeLogDirectory = "data/trade-log";

    /** Accounts whose name starts with this prefix are simulated (training) accounts. */
    private String trainingAccountPrefix = "TR";

    /** Maximum accepted difference between computed and broker-reported daily P&L. */
    private BigDecimal reconciliationTolerance = new BigDecimal("0.50");
}
