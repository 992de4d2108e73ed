package com.prospectpulse.backend.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Field names shared by the stages.
 */
final class LeadFields {

    static final String COMPANY = "company";
    static final String NAME = "name";
    static final String SIGNALS = "signals";
    static final String TECH_STACK = "tech_stack";
    static final String RISKS = "risks";
    static final String FIT_SCORE = "fit_score";
    static final String WEDGE = "wedge";

    static final String UNKNOWN_COMPANY = "Unknown Co";

    private LeadFields() {
    }

    static String company(Map<String, Object> lead) {
        Object company = lead.get(COMPANY);
        if (company == null || company.toString().isBlank()) {
            company = lead.get(NAME);
        }
        return company != null && !company.toString().isBlank() ? company.toString() : UNKNOWN_COMPANY;
    }

    static List<String> strings(Map<String, Object> record, String field) {
        Object value = record.get(field);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
