package com.residencepark.visitorparking.dto;

import com.residencepark.visitorparking.entity.VisitorStatus;
import lombok.*;

import java.time.LocalDate;

/**
 * Criteria for VisitorService.filterVisitors. Every null field is ignored;
 * the rest are combined with AND.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VisitorFilter {

    /** Case-insensitive substring of name, identity number or license plate */
    private String query;

    private VisitorStatus status;

    /** Exact unit number (compared after upper-casing) */
    private String unitNumber;

    /** Inclusive registration date range */
    private LocalDate registeredFrom;
    private LocalDate registeredTo;

    public boolean isEmpty() {
        return (query == null || query.isBlank())
                && status == null
                && (unitNumber == null || unitNumber.isBlank())
                && registeredFrom == null
                && registeredTo == null;
    }
}
