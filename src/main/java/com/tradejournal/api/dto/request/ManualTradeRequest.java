package com.tradejournal.api.dto.request;

import com.tradejournal.domain.enums.TradeDirection;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for logging a trade by hand. Date and time default to now.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualTradeRequest {

    @NotBlank(message = "Symbol is required")
    @Size(max = 20, message = "Symbol must be 20 characters or less")
    private String symbol;

    @NotNull(message = "Direction is required (LONG or SHORT)")
    private TradeDirection direction;

    @NotNull(message = "Entry price is required")
    @DecimalMin(value = "0.0001", message = "Entry price must be positive")
    private BigDecimal entryPrice;

    @NotNull(message = "Exit price is required")
    @DecimalMin(value = "0.0001", message = "Exit price must be positive")
    private BigDecimal exitPrice;

    @Min(value = 1, message = "Shares must be at least 1")
    private int shares;

    @Size(max = 100, message = "Setup must be 100 characters or less")
    private String setup;

    @Size(max = 2000, message = "Notes must be 2000 characters or less")
    private String notes;

    private LocalDate date;

    private LocalTime time;
}
