package com.residencepark.visitorparking.controller;

import com.residencepark.visitorparking.dto.ApiResponse;
import com.residencepark.visitorparking.dto.StatusUpdateRequest;
import com.residencepark.visitorparking.dto.VisitorFilter;
import com.residencepark.visitorparking.dto.VisitorRegistrationRequest;
import com.residencepark.visitorparking.entity.Visitor;
import com.residencepark.visitorparking.entity.VisitorStatus;
import com.residencepark.visitorparking.exception.ValidationException;
import com.residencepark.visitorparking.service.VisitorService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VisitorController — request mapping onto VisitorService and
 * response shaping. Error mapping is covered by GlobalExceptionHandlerTest.
 */
@ExtendWith(MockitoExtension.class)
class VisitorControllerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock
    private VisitorService visitorService;

    @InjectMocks
    private VisitorController visitorController;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private Visitor buildVisitor() {
        return Visitor.builder()
                .id(42L)
                .name("Alice Tan")
                .identityNumber("901231145678")
                .licensePlate("JOM1234")
                .unitNumber("B-1-01")
                .status(VisitorStatus.ACTIVE)
                .createdAt(LocalDateTime.of(2026, 10, 19, 8, 15))
                .build();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Register
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("POST /api/visitors → 201 with the new id as a string")
    void register_returnsCreatedWithId() {
        when(visitorService.register("Alice Tan", "901231145678", "jom1234", "b-1-01"))
                .thenReturn(buildVisitor());

        ResponseEntity<ApiResponse> response = visitorController.register(
                new VisitorRegistrationRequest("Alice Tan", "901231145678", "jom1234", "b-1-01"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody().isSuccess()).isTrue();
        assertThat(response.getBody().getData()).isEqualTo(Map.of("visitorId", "42"));
    }

    // ════════════════════════════════════════════════════════════════════════
    // List and get
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("GET /api/visitors without parameters lists everything")
    @SuppressWarnings("unchecked")
    void list_noFilter_listsAll() {
        when(visitorService.listAll()).thenReturn(List.of(buildVisitor()));

        ResponseEntity<ApiResponse> response = visitorController.list(null, null, null, null, null);

        List<Map<String, Object>> data = (List<Map<String, Object>>) response.getBody().getData();
        assertThat(data).hasSize(1);
        assertThat(data.get(0))
                .containsEntry("id", "42")
                .containsEntry("licensePlate", "JOM1234")
                .containsEntry("status", "active")
                .containsEntry("lastUpdated", null);
        verify(visitorService, never()).filterVisitors(any());
    }

    @Test
    @DisplayName("GET /api/visitors with criteria builds a filter with the parsed status")
    void list_withCriteria_filters() {
        when(visitorService.filterVisitors(any(VisitorFilter.class))).thenReturn(List.of());

        visitorController.list("jom", "LEFT", "b-1-01", LocalDate.of(2026, 1, 1), null);

        ArgumentCaptor<VisitorFilter> captor = ArgumentCaptor.forClass(VisitorFilter.class);
        verify(visitorService).filterVisitors(captor.capture());
        VisitorFilter filter = captor.getValue();
        assertThat(filter.getQuery()).isEqualTo("jom");
        assertThat(filter.getStatus()).isEqualTo(VisitorStatus.LEFT);
        assertThat(filter.getUnitNumber()).isEqualTo("b-1-01");
        assertThat(filter.getRegisteredFrom()).isEqualTo(LocalDate.of(2026, 1, 1));
        assertThat(filter.getRegisteredTo()).isNull();
    }

    @Test
    @DisplayName("unknown status filter → ValidationException")
    void list_badStatus_rejected() {
        assertThatThrownBy(() -> visitorController.list(null, "parked", null, null, null))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(visitorService);
    }

    @Test
    @DisplayName("GET /api/visitors/{id} maps the record")
    @SuppressWarnings("unchecked")
    void get_mapsRecord() {
        when(visitorService.getVisitor("42")).thenReturn(buildVisitor());

        ResponseEntity<ApiResponse> response = visitorController.get("42");

        assertThat((Map<String, Object>) response.getBody().getData())
                .containsEntry("name", "Alice Tan")
                .containsEntry("createdAt", "2026-10-19T08:15");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Status and delete
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("PUT status reports whether the status changed")
    void updateStatus_reportsChange() {
        when(visitorService.updateStatus("42", "left")).thenReturn(true);
        when(visitorService.updateStatus("43", " LEFT ")).thenReturn(false);

        ResponseEntity<ApiResponse> changed = visitorController.updateStatus("42", new StatusUpdateRequest("left"));
        ResponseEntity<ApiResponse> same    = visitorController.updateStatus("43", new StatusUpdateRequest(" LEFT "));

        assertThat(changed.getBody().getData()).isEqualTo(Map.of("changed", true));
        assertThat(changed.getBody().getMessage()).isEqualTo("Visitor status updated successfully");
        assertThat(same.getBody().getData()).isEqualTo(Map.of("changed", false));
        assertThat(same.getBody().getMessage()).isEqualTo("Visitor status already left");
    }

    @Test
    @DisplayName("DELETE delegates to the service")
    void delete_delegates() {
        ResponseEntity<ApiResponse> response = visitorController.delete("42");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getMessage()).isEqualTo("Visitor deleted successfully");
        verify(visitorService).delete("42");
    }
}
