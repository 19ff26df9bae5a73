package com.grievancedss.api;

import com.grievancedss.adjudication.AdjudicationService;
import com.grievancedss.fairness.FairnessMetrics;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/fairness")
public class FairnessController {

    private final AdjudicationService adjudicationService;

    public FairnessController(AdjudicationService adjudicationService) {
        this.adjudicationService = adjudicationService;
    }

    @GetMapping("/metrics")
    public FairnessMetrics metrics() {
        return adjudicationService.fairnessMetrics();
    }
}
