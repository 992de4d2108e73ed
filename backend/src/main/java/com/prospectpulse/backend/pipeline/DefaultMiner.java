package com.prospectpulse.backend.pipeline;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Placeholder miner producing synthetic findings until a real signal source
 * (forums, review sites) is wired in.
 */
@Component
public class DefaultMiner implements Miner {

    @Override
    public Map<String, Object> mine(Map<String, Object> lead) {
        String company = LeadFields.company(lead);
        Map<String, Object> mined = new LinkedHashMap<>();
        mined.put(LeadFields.COMPANY, company);
        mined.put(LeadFields.SIGNALS, List.of(
                company + " mentioned cost pressures on forums",
                company + " evaluating cloud spend reduction"));
        return mined;
    }
}
