package com.residencepark.visitorparking.chat;

import com.residencepark.visitorparking.dto.ParkingStatistics;
import com.residencepark.visitorparking.entity.Visitor;
import com.residencepark.visitorparking.service.ParkingStatisticsService;
import com.residencepark.visitorparking.service.VisitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Runs the read-only lookup behind a classified intent and renders it as
 * deterministic plain text.
 *
 *   STATS   → active / left / total counts and available spots
 *   SUMMARY → FULL / LOW / AVAILABLE verdict with counts
 *   SEARCH  → first visitor whose name contains the parameter
 *   UNIT    → every visitor registered to the unit
 *   LIST    → the 20 most recent visitors
 *   GENERAL → fixed capability blurb
 *
 * Never mutates anything.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolDispatcher {

    static final int LIST_LIMIT = 20;

    static final String GENERAL_CONTEXT = "I can help with visitor info, parking stats, and searching. "
            + "Please ask about visitors, parking availability, or specific units.";

    static final String MISSING_NAME_REPLY =
            "Please specify a visitor name. Example: 'Find visitor John'";

    static final String MISSING_UNIT_REPLY =
            "Please specify a unit number. Example: 'Show visitors for unit B-1-01'";

    private static final DateTimeFormatter REGISTERED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final VisitorService visitorService;
    private final ParkingStatisticsService statisticsService;

    /**
     * @throws IllegalArgumentException for templated intents, which have no tool
     */
    public ToolResult dispatch(ClassifiedIntent classified) {
        ChatIntent intent = classified.getIntent();
        log.debug("Dispatching tool for {}", classified);

        switch (intent) {
            case STATS:
                return ToolResult.context(intent, renderStats(statisticsService.getStatistics()));
            case SUMMARY:
                return ToolResult.context(intent, renderSummary(statisticsService.getStatistics()));
            case SEARCH:
                return classified.getParameter()
                        .map(name -> ToolResult.context(intent, renderSearch(name, visitorService.findByName(name))))
                        .orElseGet(() -> ToolResult.direct(intent, MISSING_NAME_REPLY));
            case UNIT:
                return classified.getParameter()
                        .map(unit -> ToolResult.context(intent, renderUnit(unit, visitorService.findByUnit(unit))))
                        .orElseGet(() -> ToolResult.direct(intent, MISSING_UNIT_REPLY));
            case LIST:
                return ToolResult.context(intent, renderList(visitorService.listRecent()));
            case GENERAL:
                return ToolResult.context(intent, GENERAL_CONTEXT);
            default:
                throw new IllegalArgumentException("No tool for templated intent " + intent);
        }
    }

    // ── Renderers ─────────────────────────────────────────────────────────────

    static String renderStats(ParkingStatistics stats) {
        return "Active visitors: " + stats.getActiveCount() + "\n"
                + "Left visitors: " + stats.getLeftCount() + "\n"
                + "Total registered: " + stats.getTotalCount() + "\n"
                + "Available spots: " + stats.getAvailableSpots() + "/" + stats.getCapacity() + "\n"
                + "Occupancy rate: " + String.format(Locale.ROOT, "%.1f", stats.getOccupancyRate()) + "%";
    }

    static String renderSummary(ParkingStatistics stats) {
        String verdict;
        switch (stats.getLevel()) {
            case FULL:
                verdict = "PARKING FULL";
                break;
            case LOW:
                verdict = "LOW AVAILABILITY";
                break;
            default:
                verdict = "PARKING AVAILABLE";
        }
        return verdict + "\n" + stats.getActiveCount() + " cars parked, "
                + stats.getAvailableSpots() + " spots available";
    }

    static String renderSearch(String name, Optional<Visitor> match) {
        if (match.isEmpty()) {
            return "No visitor found with name '" + name + "'.";
        }
        Visitor v = match.get();
        return "Found visitor:\n"
                + "Name: " + v.getName() + "\n"
                + "Identity number: " + v.getIdentityNumber() + "\n"
                + "Plate: " + v.getLicensePlate() + "\n"
                + "Unit: " + v.getUnitNumber() + "\n"
                + "Status: " + v.getStatus().value() + "\n"
                + "Registered: " + formatTime(v.getCreatedAt());
    }

    static String renderUnit(String unit, List<Visitor> visitors) {
        if (visitors.isEmpty()) {
            return "No visitors found for unit " + unit + ".";
        }
        StringBuilder sb = new StringBuilder("Found " + visitors.size() + " visitor(s) for unit " + unit + ":");
        int i = 1;
        for (Visitor v : visitors) {
            sb.append('\n').append(i++).append(". ").append(v.getName())
                    .append(" - ").append(v.getLicensePlate())
                    .append(" (").append(v.getStatus().value()).append(')');
        }
        return sb.toString();
    }

    static String renderList(List<Visitor> visitors) {
        if (visitors.isEmpty()) {
            return "No visitors found in the database.";
        }
        List<Visitor> shown = visitors.size() > LIST_LIMIT ? visitors.subList(0, LIST_LIMIT) : visitors;
        StringBuilder sb = new StringBuilder("Total visitors found: " + shown.size());
        int i = 1;
        for (Visitor v : shown) {
            sb.append("\n\n").append(i++).append(". ").append(v.getName())
                    .append("\n   - Identity number: ").append(v.getIdentityNumber())
                    .append("\n   - Plate: ").append(v.getLicensePlate())
                    .append("\n   - Unit: ").append(v.getUnitNumber())
                    .append("\n   - Status: ").append(v.getStatus().value())
                    .append("\n   - Registered: ").append(formatTime(v.getCreatedAt()));
        }
        return sb.toString();
    }

    private static String formatTime(LocalDateTime time) {
        return time != null ? time.format(REGISTERED_FORMAT) : "N/A";
    }
}
