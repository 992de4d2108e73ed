package com.prospectpulse.backend.controller;

import com.prospectpulse.backend.exception.ProspectPulseException;
import com.prospectpulse.backend.service.LeadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/leads")
@Tag(name = "Leads", description = "Synthesized leads")
public class LeadController {

    private final LeadService leadService;

    public LeadController(LeadService leadService) {
        this.leadService = leadService;
    }

    @GetMapping
    @Operation(summary = "List leads", description = "Paginated list of all synthesized leads")
    public ResponseEntity<?> listLeads(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int size) {
        if (page < 1 || size < 1) {
            return ApiErrors.badRequest("page and size must be positive");
        }
        try {
            return ResponseEntity.ok(leadService.list(page, size));
        } catch (ProspectPulseException e) {
            return ApiErrors.of(e);
        }
    }
}
