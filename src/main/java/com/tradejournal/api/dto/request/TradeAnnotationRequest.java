package com.tradejournal.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for annotating a trade. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeAnnotationRequest {

    @Size(max = 100, message = "Setup must be 100 characters or less")
    private String setup;

    @Size(max = 2000, message = "Notes must be 2000 characters or less")
    private String notes;

    @Size(max = 255, message = "Chart must be 255 characters or less")
    private String chart;
}
