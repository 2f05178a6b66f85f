package com.residencepark.visitorparking.controller;

import com.residencepark.visitorparking.dto.ApiResponse;
import com.residencepark.visitorparking.dto.StatusUpdateRequest;
import com.residencepark.visitorparking.dto.VisitorFilter;
import com.residencepark.visitorparking.dto.VisitorRegistrationRequest;
import com.residencepark.visitorparking.entity.Visitor;
import com.residencepark.visitorparking.entity.VisitorStatus;
import com.residencepark.visitorparking.exception.ValidationException;
import com.residencepark.visitorparking.service.VisitorService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Visitor registration REST API.
 *
 * Endpoints:
 *  POST   /api/visitors                 — register a visitor
 *  GET    /api/visitors                 — list (newest first), optionally filtered
 *  GET    /api/visitors/{id}            — single visitor
 *  GET    /api/visitors/units           — unit numbers with visitor records
 *  PUT    /api/visitors/{id}/status     — mark active / left
 *  DELETE /api/visitors/{id}            — remove permanently
 *
 * Errors are mapped by GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api/visitors")
@RequiredArgsConstructor
@Slf4j
public class VisitorController {

    private final VisitorService visitorService;

    @PostMapping
    public ResponseEntity<ApiResponse> register(@Valid @RequestBody VisitorRegistrationRequest req) {
        log.info("API: register visitor — plate: {}, unit: {}", req.getLicensePlate(), req.getUnitNumber());

        Visitor visitor = visitorService.register(
                req.getName(), req.getIdentityNumber(), req.getLicensePlate(), req.getUnitNumber());

        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(
                Map.of("visitorId", String.valueOf(visitor.getId())),
                "Visitor created successfully"));
    }

    /**
     * GET /api/visitors?q=jom&status=active&unit=B-1-01&from=2026-01-01&to=2026-01-31
     *
     * Without parameters returns every visitor.
     */
    @GetMapping
    public ResponseEntity<ApiResponse> list(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String unit,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        VisitorFilter filter = VisitorFilter.builder()
                .query(query)
                .status(status == null || status.isBlank() ? null : parseStatus(status))
                .unitNumber(unit)
                .registeredFrom(from)
                .registeredTo(to)
                .build();

        List<Visitor> visitors = filter.isEmpty()
                ? visitorService.listAll()
                : visitorService.filterVisitors(filter);

        return ResponseEntity.ok(ApiResponse.success(toResponseList(visitors),
                "Found " + visitors.size() + " visitor(s)"));
    }

    @GetMapping("/{visitorId}")
    public ResponseEntity<ApiResponse> get(@PathVariable String visitorId) {
        Visitor visitor = visitorService.getVisitor(visitorId);
        return ResponseEntity.ok(ApiResponse.success(toResponse(visitor), "Visitor #" + visitor.getId()));
    }

    @GetMapping("/units")
    public ResponseEntity<ApiResponse> units() {
        List<String> units = visitorService.listUnitNumbers();
        return ResponseEntity.ok(ApiResponse.success(units, units.size() + " unit(s) with visitor records"));
    }

    /**
     * PUT /api/visitors/{id}/status  {"status": "left"}
     *
     * Re-applying the current status succeeds with changed=false.
     */
    @PutMapping("/{visitorId}/status")
    public ResponseEntity<ApiResponse> updateStatus(
            @PathVariable String visitorId,
            @Valid @RequestBody StatusUpdateRequest req) {

        log.info("API: status update for visitor {} → {}", visitorId, req.getStatus());
        boolean changed = visitorService.updateStatus(visitorId, req.getStatus());

        String msg = changed
                ? "Visitor status updated successfully"
                : "Visitor status already " + req.getStatus().trim().toLowerCase(Locale.ROOT);
        return ResponseEntity.ok(ApiResponse.success(Map.of("changed", changed), msg));
    }

    @DeleteMapping("/{visitorId}")
    public ResponseEntity<ApiResponse> delete(@PathVariable String visitorId) {
        log.info("API: delete visitor {}", visitorId);
        visitorService.delete(visitorId);
        return ResponseEntity.ok(ApiResponse.success("Visitor deleted successfully"));
    }

    private static VisitorStatus parseStatus(String status) {
        return VisitorStatus.parse(status)
                .orElseThrow(() -> new ValidationException(
                        "Invalid status '" + status + "'. Must be 'active' or 'left'"));
    }

    static Map<String, Object> toResponse(Visitor v) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id",             String.valueOf(v.getId()));
        m.put("name",           v.getName());
        m.put("identityNumber", v.getIdentityNumber());
        m.put("licensePlate",   v.getLicensePlate());
        m.put("unitNumber",     v.getUnitNumber());
        m.put("status",         v.getStatus().value());
        m.put("createdAt",      v.getCreatedAt() != null ? v.getCreatedAt().toString() : null);
        m.put("lastUpdated",    v.getLastUpdated() != null ? v.getLastUpdated().toString() : null);
        return m;
    }

    private static List<Map<String, Object>> toResponseList(List<Visitor> visitors) {
        return visitors.stream().map(VisitorController::toResponse).toList();
    }
}
