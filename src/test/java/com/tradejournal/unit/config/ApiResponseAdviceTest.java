package com.tradejournal.unit.config;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradejournal.api.controller.StatsController;
import com.tradejournal.config.ApiResponseAdvice;
import com.tradejournal.domain.model.GroupedStat;
import com.tradejournal.exception.BusinessException;
import com.tradejournal.exception.GlobalExceptionHandler;
import com.tradejournal.reporting.ReportingService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ApiResponseAdviceTest {

    @Mock
    private ReportingService reportingService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new StatsController(reportingService))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    void listPayload_wrappedWithCount() throws Exception {
        when(reportingService.getStatsBySetup(isNull(), isNull()))
                .thenReturn(List.of(stat("orb"), stat("vwap-reclaim"), stat("(untagged)")));

        mockMvc.perform(get("/api/stats/by-setup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.data[1].key").value("vwap-reclaim"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void errorBody_notWrapped() throws Exception {
        LocalDate from = LocalDate.of(2026, 2, 1);
        LocalDate to = LocalDate.of(2026, 1, 1);
        when(reportingService.getStatsBySetup(from, to))
                .thenThrow(new BusinessException(
                        "'from' must not be after 'to'", Map.of("from", "2026-02-01", "to", "2026-01-01")));

        mockMvc.perform(get("/api/stats/by-setup").param("from", "2026-02-01").param("to", "2026-01-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.details.from").value("2026-02-01"))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    private static GroupedStat stat(String key) {
        return GroupedStat.builder()
                .key(key)
                .tradeCount(1)
                .totalPnl(new BigDecimal("12.50"))
                .avgPnl(new BigDecimal("12.50"))
                .winners(1)
                .losers(0)
                .winRate(new BigDecimal("100.00"))
                .build();
    }
}
