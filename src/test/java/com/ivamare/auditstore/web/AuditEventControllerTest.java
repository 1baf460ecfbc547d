package com.ivamare.auditstore.web;

import com.ivamare.auditstore.exception.PartitionMissingException;
import com.ivamare.auditstore.exception.ReferentialIntegrityException;
import com.ivamare.auditstore.exception.ValidationException;
import com.ivamare.auditstore.ingest.IngestContext;
import com.ivamare.auditstore.ingest.IngestResult;
import com.ivamare.auditstore.ingest.IngestionGateway;
import com.ivamare.auditstore.ingest.impl.DefaultIngestionGateway;
import com.ivamare.auditstore.model.AuditEventRequest;
import com.ivamare.auditstore.model.InsertOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuditEventController")
class AuditEventControllerTest {

    private static final UUID EVENT_ID = UUID.fromString("3f2b8c1e-9d4a-4b6e-8f1a-2c3d4e5f6a7b");

    private static final String BODY = """
        {
          "event_id": "3f2b8c1e-9d4a-4b6e-8f1a-2c3d4e5f6a7b",
          "service": "workflow-engine",
          "event_type": "workflow.started",
          "event_timestamp": "2025-11-18T10:00:00Z",
          "correlation_id": "rr-2025-001",
          "outcome": "success",
          "operation": "start_workflow",
          "event_data": {"workflow_id": "wf-1"}
        }
        """;

    @Mock
    private IngestionGateway gateway;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AuditEventController(gateway))
            .setControllerAdvice(new AuditStoreExceptionHandler())
            .build();
    }

    @Nested
    @DisplayName("POST /api/v1/audit/events")
    class Single {

        @Test
        @DisplayName("should return 201 for stored event")
        void shouldReturnCreated() throws Exception {
            when(gateway.ingest(any(AuditEventRequest.class), any(IngestContext.class)))
                .thenReturn(IngestResult.accepted(EVENT_ID, LocalDate.of(2025, 11, 18), InsertOutcome.CREATED));

            mockMvc.perform(post("/api/v1/audit/events").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.event_id").value(EVENT_ID.toString()))
                .andExpect(jsonPath("$.event_date").value("2025-11-18"))
                .andExpect(jsonPath("$.status").value("created"));

            verify(gateway).ingest(argThat(r -> "workflow-engine".equals(r.service())
                && "wf-1".equals(r.eventData().get("workflow_id"))), any(IngestContext.class));
        }

        @Test
        @DisplayName("should return 201 with duplicate status for replayed event id")
        void shouldReturnDuplicate() throws Exception {
            when(gateway.ingest(any(AuditEventRequest.class), any(IngestContext.class)))
                .thenReturn(IngestResult.accepted(EVENT_ID, LocalDate.of(2025, 11, 18), InsertOutcome.DUPLICATE));

            mockMvc.perform(post("/api/v1/audit/events").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("duplicate"));
        }

        @Test
        @DisplayName("should return 202 when event was queued")
        void shouldReturnAcceptedWhenQueued() throws Exception {
            when(gateway.ingest(any(AuditEventRequest.class), any(IngestContext.class)))
                .thenReturn(IngestResult.queued(EVENT_ID));

            mockMvc.perform(post("/api/v1/audit/events").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("queued"))
                .andExpect(jsonPath("$.event_date").doesNotExist());
        }

        @Test
        @DisplayName("should return 400 problem for validation failure")
        void shouldReturnBadRequestForValidationFailure() throws Exception {
            when(gateway.ingest(any(AuditEventRequest.class), any(IngestContext.class)))
                .thenThrow(new ValidationException(List.of("outcome is required", "operation is required")));

            mockMvc.perform(post("/api/v1/audit/events").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value(AuditStoreExceptionHandler.TYPE_BASE + "validation-error"))
                .andExpect(jsonPath("$.instance").value("/api/v1/audit/events"))
                .andExpect(jsonPath("$.violations.length()").value(2));
        }

        @Test
        @DisplayName("should return 400 problem for unknown parent")
        void shouldReturnBadRequestForUnknownParent() throws Exception {
            UUID parent = UUID.randomUUID();
            when(gateway.ingest(any(AuditEventRequest.class), any(IngestContext.class)))
                .thenThrow(new ReferentialIntegrityException(parent));

            mockMvc.perform(post("/api/v1/audit/events").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value(AuditStoreExceptionHandler.TYPE_BASE + "parent-not-found"))
                .andExpect(jsonPath("$.parent_event_id").value(parent.toString()));
        }

        @Test
        @DisplayName("should return 500 problem when partition is missing")
        void shouldReturnServerErrorForMissingPartition() throws Exception {
            when(gateway.ingest(any(AuditEventRequest.class), any(IngestContext.class)))
                .thenThrow(new PartitionMissingException(LocalDate.of(2025, 11, 18)));

            mockMvc.perform(post("/api/v1/audit/events").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.partition").value("2025-11"));
        }

        @Test
        @DisplayName("should return 400 problem for malformed JSON")
        void shouldReturnBadRequestForMalformedJson() throws Exception {
            mockMvc.perform(post("/api/v1/audit/events").contentType(MediaType.APPLICATION_JSON).content("{\"service\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value(AuditStoreExceptionHandler.TYPE_BASE + "malformed-request"));

            verifyNoInteractions(gateway);
        }
    }

    @Nested
    @DisplayName("POST /api/v1/audit/events/batch")
    class Batch {

        @Test
        @DisplayName("should return per-event results and counts")
        void shouldReturnPerEventResults() throws Exception {
            UUID rejected = UUID.randomUUID();
            when(gateway.ingestBatch(anyList())).thenReturn(List.of(
                IngestResult.accepted(EVENT_ID, LocalDate.of(2025, 11, 18), InsertOutcome.CREATED),
                IngestResult.rejected(rejected, DefaultIngestionGateway.REASON_VALIDATION,
                    List.of("outcome is required"))));

            mockMvc.perform(post("/api/v1/audit/events/batch").contentType(MediaType.APPLICATION_JSON)
                    .content("[" + BODY + "," + BODY + "]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(1))
                .andExpect(jsonPath("$.rejected").value(1))
                .andExpect(jsonPath("$.results[1].reason").value("validation_failed"))
                .andExpect(jsonPath("$.results[1].violations[0]").value("outcome is required"));
        }

        @Test
        @DisplayName("should reject empty batch")
        void shouldRejectEmptyBatch() throws Exception {
            mockMvc.perform(post("/api/v1/audit/events/batch").contentType(MediaType.APPLICATION_JSON).content("[]"))
                .andExpect(status().isBadRequest());

            verifyNoInteractions(gateway);
        }

        @Test
        @DisplayName("should reject batch over the size limit")
        void shouldRejectOversizeBatch() throws Exception {
            StringBuilder body = new StringBuilder("[");
            for (int i = 0; i <= AuditEventController.MAX_BATCH_SIZE; i++) {
                body.append(i == 0 ? "" : ",").append("{}");
            }
            body.append("]");

            mockMvc.perform(post("/api/v1/audit/events/batch").contentType(MediaType.APPLICATION_JSON)
                    .content(body.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("batch exceeds 1000 events"));
        }
    }
}
