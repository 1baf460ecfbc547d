package com.ivamare.auditstore.web;

import com.ivamare.auditstore.aggregation.AggregationService;
import com.ivamare.auditstore.aggregation.AiExecutionMode;
import com.ivamare.auditstore.aggregation.ConfidenceLevel;
import com.ivamare.auditstore.aggregation.IncidentTypeSuccessRate;
import com.ivamare.auditstore.aggregation.MultiDimensionalSuccessRate;
import com.ivamare.auditstore.aggregation.PlaybookBreakdown;
import com.ivamare.auditstore.aggregation.SuccessRateQuery;
import com.ivamare.auditstore.aggregation.TimeRange;
import com.ivamare.auditstore.exception.AggregationException;
import com.ivamare.auditstore.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SuccessRateControllerTest {

    @Mock
    private AggregationService aggregationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SuccessRateController(aggregationService))
            .setControllerAdvice(new AuditStoreExceptionHandler())
            .build();
    }

    @Test
    void shouldReturnIncidentTypeReportWithDefaults() throws Exception {
        when(aggregationService.successRateByIncidentType("OOMKilled", "7d", 5)).thenReturn(
            new IncidentTypeSuccessRate("OOMKilled", TimeRange.SEVEN_DAYS, 150, 135, 15, 90.0,
                ConfidenceLevel.HIGH, true, new AiExecutionMode(150, 0, 0, 0),
                List.of(new PlaybookBreakdown("oom-recovery", "v1", 150, 135, 90.0, ConfidenceLevel.HIGH))));

        mockMvc.perform(get("/api/v1/success-rate/incident-type").param("incident_type", "OOMKilled"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.incident_type").value("OOMKilled"))
            .andExpect(jsonPath("$.time_range").value("7d"))
            .andExpect(jsonPath("$.success_rate").value(90.0))
            .andExpect(jsonPath("$.confidence").value("high"))
            .andExpect(jsonPath("$.min_samples_met").value(true))
            .andExpect(jsonPath("$.ai_execution_mode.catalog_selected").value(150))
            .andExpect(jsonPath("$.breakdown_by_playbook[0].playbook_id").value("oom-recovery"));
    }

    @Test
    void shouldRequireIncidentType() throws Exception {
        mockMvc.perform(get("/api/v1/success-rate/incident-type"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.violations[0]").value("incident_type is required"));

        verifyNoInteractions(aggregationService);
    }

    @Test
    void shouldRejectNonNumericMinSamples() throws Exception {
        mockMvc.perform(get("/api/v1/success-rate/incident-type")
                .param("incident_type", "OOMKilled").param("min_samples", "many"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldMapInvalidTimeRangeToBadRequest() throws Exception {
        when(aggregationService.successRateByPlaybook("oom-recovery", null, "2w", 5))
            .thenThrow(new ValidationException("invalid time_range '2w', expected one of 1h, 24h, 7d, 30d, 90d"));

        mockMvc.perform(get("/api/v1/success-rate/playbook")
                .param("playbook_id", "oom-recovery").param("time_range", "2w"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.title").value("Validation Error"));
    }

    @Test
    void shouldPassAllDimensionsToService() throws Exception {
        when(aggregationService.successRateMultiDimensional(any(SuccessRateQuery.class))).thenReturn(
            new MultiDimensionalSuccessRate(
                new MultiDimensionalSuccessRate.Dimensions("OOMKilled", null, null, "restart_pod"),
                TimeRange.THIRTY_DAYS, 3, 3, 0, 100.0, ConfidenceLevel.INSUFFICIENT_DATA, false));

        mockMvc.perform(get("/api/v1/success-rate/multi-dimensional")
                .param("incident_type", "OOMKilled").param("action_type", "restart_pod")
                .param("time_range", "30d").param("min_samples", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dimensions.incident_type").value("OOMKilled"))
            .andExpect(jsonPath("$.dimensions.playbook_id").doesNotExist())
            .andExpect(jsonPath("$.confidence").value("insufficient_data"));

        verify(aggregationService).successRateMultiDimensional(
            new SuccessRateQuery("OOMKilled", null, null, "restart_pod", "30d", 10));
    }

    @Test
    void shouldReturnServerErrorWhenAggregationFails() throws Exception {
        when(aggregationService.successRateByIncidentType(anyString(), anyString(), anyInt()))
            .thenThrow(new AggregationException("Failed to compute success rate", new RuntimeException("timeout")));

        mockMvc.perform(get("/api/v1/success-rate/incident-type").param("incident_type", "OOMKilled"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.detail").value("Success rate could not be computed"));
    }
}
