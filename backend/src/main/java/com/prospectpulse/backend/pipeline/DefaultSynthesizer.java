package com.prospectpulse.backend.pipeline;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores the lead from its signals and risks and picks a sales wedge.
 * Score: 90 with signals, 70 without, minus 5 per risk, clamped to 0..100.
 */
@Component
public class DefaultSynthesizer implements Synthesizer {

    @Override
    public Map<String, Object> synthesize(Map<String, Object> lead,
            Map<String, Object> mined,
            Map<String, Object> validated) {
        String company = LeadFields.company(lead);
        List<String> signals = LeadFields.strings(mined, LeadFields.SIGNALS);
        int riskPenalty = LeadFields.strings(validated, LeadFields.RISKS).size() * 5;
        int baseScore = signals.isEmpty() ? 70 : 90;
        int score = Math.max(0, Math.min(100, baseScore - riskPenalty));

        String wedge = company + " can trim tooling costs with your bundled pricing.";
        if (String.join(" ", signals).toLowerCase(Locale.ROOT).contains("cost")) {
            wedge = company + " faces cost pressure; lead with ROI and consolidation.";
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put(LeadFields.COMPANY, company);
        result.put(LeadFields.FIT_SCORE, score);
        result.put(LeadFields.WEDGE, wedge);
        result.put(LeadFields.TECH_STACK, LeadFields.strings(validated, LeadFields.TECH_STACK));
        result.put(LeadFields.SIGNALS, signals);
        return result;
    }
}
