package com.residencepark.visitorparking.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shows API info at the root URL
 */
@RestController
public class HomeController {

    @GetMapping("/")
    public Map<String, Object> home() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("application", "Visitor Parking Management");
        info.put("status", "Running");

        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("POST /api/visitors", "Register a visitor");
        endpoints.put("GET /api/visitors", "List visitors (q, status, unit, from, to filters)");
        endpoints.put("GET /api/visitors/{id}", "Get one visitor");
        endpoints.put("GET /api/visitors/units", "Unit numbers with visitors");
        endpoints.put("PUT /api/visitors/{id}/status", "Mark visitor active / left");
        endpoints.put("DELETE /api/visitors/{id}", "Delete a visitor");
        endpoints.put("GET /api/statistics", "Parking occupancy");
        endpoints.put("POST /api/chat", "Ask the parking assistant");
        endpoints.put("GET /swagger-ui.html", "API documentation");
        info.put("endpoints", endpoints);

        info.put("sampleRequest", Map.of(
                "url", "POST /api/visitors",
                "body", Map.of(
                        "name", "Alice Tan",
                        "identityNumber", "901231145678",
                        "licensePlate", "JOM1234",
                        "unitNumber", "B-1-01"
                )
        ));
        return info;
    }

}
