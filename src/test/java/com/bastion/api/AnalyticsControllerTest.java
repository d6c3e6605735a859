package com.bastion.api;

import com.bastion.analytics.EventAnalyticsService;
import com.bastion.analytics.RollupQueryRepository;
import com.bastion.analytics.RollupUpdater;
import com.bastion.domain.DailyActionCount;
import com.bastion.domain.RuleType;
import com.bastion.domain.Summary;
import com.bastion.domain.TimeSeriesPoint;
import com.bastion.domain.TopIp;
import com.bastion.domain.TopRule;
import com.bastion.domain.TrendBucket;
import com.bastion.domain.TrendSeries;
import com.bastion.domain.WafAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnalyticsController Tests")
class AnalyticsControllerTest {

    @Mock
    private RollupQueryRepository queryRepository;

    @Mock
    private RollupUpdater rollupUpdater;

    @Mock
    private EventAnalyticsService analyticsService;

    @InjectMocks
    private AnalyticsController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("Should return top rules with the default limit")
    void shouldReturnTopRules() throws Exception {
        when(queryRepository.topRules(20)).thenReturn(List.of(
            new TopRule("managed_sqli", "SQL injection", RuleType.MANAGED, 12, 1_700_000_000_000L)));

        mockMvc.perform(get("/api/top/rules"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].rule_id").value("managed_sqli"))
            .andExpect(jsonPath("$[0].rule_type").value("managed"))
            .andExpect(jsonPath("$[0].count").value(12));
    }

    @Test
    @DisplayName("Should return top IPs with their country and ASN sets")
    void shouldReturnTopIps() throws Exception {
        when(queryRepository.topIps(5)).thenReturn(List.of(
            new TopIp("192.0.2.1", 4, List.of("DE", "FR"), List.of(3320L), 1_700_000_000_000L)));

        mockMvc.perform(get("/api/top/ips").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].src_ip").value("192.0.2.1"))
            .andExpect(jsonPath("$[0].countries[1]").value("FR"))
            .andExpect(jsonPath("$[0].asns[0]").value(3320));
    }

    @Test
    @DisplayName("Should reject an out-of-range limit")
    void shouldRejectBadLimit() throws Exception {
        mockMvc.perform(get("/api/top/paths").param("limit", "0"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/top/paths").param("limit", "abc"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(queryRepository);
    }

    @Test
    @DisplayName("Should return daily action counts for a date range")
    void shouldReturnDailyTrend() throws Exception {
        when(queryRepository.dailyActions("2024-03-01", "2024-03-02")).thenReturn(List.of(
            new DailyActionCount("2024-03-01", WafAction.BLOCK, 7)));

        mockMvc.perform(get("/api/trends/daily").param("start", "2024-03-01").param("end", "2024-03-02"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].date").value("2024-03-01"))
            .andExpect(jsonPath("$[0].action").value("block"))
            .andExpect(jsonPath("$[0].count").value(7));
    }

    @Test
    @DisplayName("Should reject an inverted or malformed date range")
    void shouldRejectBadDateRange() throws Exception {
        mockMvc.perform(get("/api/trends/daily").param("start", "2024-03-05").param("end", "2024-03-01"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/trends/daily").param("start", "March 1st"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should rebuild all rollups")
    void shouldRebuild() throws Exception {
        mockMvc.perform(post("/api/rollups/rebuild"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rebuilt").value(true));

        verify(rollupUpdater).rebuildAll();
    }

    @Test
    @DisplayName("Should return the summary of the requested range")
    void shouldReturnSummary() throws Exception {
        // Given
        TimeSeriesPoint point = new TimeSeriesPoint(3_600_000L);
        point.add(WafAction.BLOCK, 4);
        when(analyticsService.summary(1_000L, 5_000_000L)).thenReturn(Summary.builder()
            .range(1_000L, 5_000_000L)
            .totalEvents(4)
            .uniqueIps(2)
            .blockedPercentage(100.0)
            .actionsBreakdown(Map.of("block", 4L))
            .geoDistribution(Map.of("DE", 4L))
            .timeSeries(List.of(point))
            .build());

        // When / Then
        mockMvc.perform(get("/api/summary").param("start_time", "1000").param("end_time", "5000000"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_events").value(4))
            .andExpect(jsonPath("$.unique_ips").value(2))
            .andExpect(jsonPath("$.blocked_percentage").value(100.0))
            .andExpect(jsonPath("$.actions_breakdown.block").value(4))
            .andExpect(jsonPath("$.geo_distribution.DE").value(4))
            .andExpect(jsonPath("$.top_rule_today").doesNotExist())
            .andExpect(jsonPath("$.time_series[0].timestamp").value(3_600_000))
            .andExpect(jsonPath("$.time_series[0].total").value(4))
            .andExpect(jsonPath("$.time_series[0].block").value(4))
            .andExpect(jsonPath("$.time_series[0].challenge").value(0));
    }

    @Test
    @DisplayName("Should default the summary to the last 24 hours")
    void shouldDefaultSummaryRange() throws Exception {
        when(analyticsService.summary(anyLong(), anyLong())).thenReturn(Summary.builder().build());

        mockMvc.perform(get("/api/summary")).andExpect(status().isOk());

        ArgumentCaptor<Long> start = ArgumentCaptor.forClass(Long.class);
        ArgumentCaptor<Long> end = ArgumentCaptor.forClass(Long.class);
        verify(analyticsService).summary(start.capture(), end.capture());
        assertThat(end.getValue() - start.getValue()).isEqualTo(86_400_000L);
    }

    @Test
    @DisplayName("Should return a bucketed trend and reject unknown bucket names")
    void shouldReturnTrends() throws Exception {
        when(analyticsService.trends(0L, 120_000L, TrendBucket.MINUTE)).thenReturn(
            new TrendSeries(TrendBucket.MINUTE, 0L, 120_000L,
                List.of(new TimeSeriesPoint(0L), new TimeSeriesPoint(60_000L), new TimeSeriesPoint(120_000L))));

        mockMvc.perform(get("/api/trends")
                .param("start_time", "0").param("end_time", "120000").param("bucket", "minute"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.bucket").value("minute"))
            .andExpect(jsonPath("$.bucket_size").value(60_000))
            .andExpect(jsonPath("$.data.length()").value(3));

        mockMvc.perform(get("/api/trends").param("bucket", "week"))
            .andExpect(status().isBadRequest());
    }
}
