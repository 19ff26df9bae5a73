package com.grievancedss.api;

import com.grievancedss.rule.AuthorityTier;
import com.grievancedss.rule.RuleRepository;
import com.grievancedss.rule.RuleSummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/rules")
public class RuleController {

    private final RuleRepository ruleRepository;

    public RuleController(RuleRepository ruleRepository) {
        this.ruleRepository = ruleRepository;
    }

    @GetMapping
    public List<RuleSummary> list() {
        return ruleRepository.findAll().stream().map(RuleSummary::of).toList();
    }

    @GetMapping("/{ruleId}")
    public RuleSummary get(@PathVariable String ruleId) {
        return ruleRepository.findById(ruleId)
            .map(RuleSummary::of)
            .orElseThrow(() -> new NotFoundException("rule", ruleId));
    }

    @GetMapping("/tier/{tier}")
    public List<RuleSummary> byTier(@PathVariable String tier) {
        return ruleRepository.findByTier(AuthorityTier.fromValue(tier)).stream()
            .map(RuleSummary::of)
            .toList();
    }

    /** Rule counts per tier, strongest tier first. */
    @GetMapping("/hierarchy")
    public Map<String, Object> hierarchy() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        ruleRepository.tierSummary().forEach((tier, count) -> counts.put(tier.getValue(), count));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("precedence", "L1_National > L2_Accreditation > L3_University");
        body.put("total_rules", ruleRepository.findAll().size());
        body.put("rules_per_tier", counts);
        return body;
    }
}
