package com.prospectpulse.backend.pipeline;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component("pipelineValidator")
public class DefaultValidator implements Validator {

    @Override
    public Map<String, Object> validate(Map<String, Object> lead) {
        Map<String, Object> validated = new LinkedHashMap<>();
        validated.put(LeadFields.COMPANY, LeadFields.company(lead));
        validated.put(LeadFields.TECH_STACK, List.of("AWS", "Salesforce"));
        validated.put(LeadFields.RISKS, List.of("Unknown budget owner"));
        return validated;
    }
}
