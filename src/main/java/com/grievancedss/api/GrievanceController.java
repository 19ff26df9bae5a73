package com.grievancedss.api;

import com.grievancedss.adjudication.Adjudication;
import com.grievancedss.adjudication.AdjudicationService;
import com.grievancedss.adjudication.GrievanceSubmission;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * POST /v1/grievances evaluates a grievance and returns decision, trace,
 * explanation and fairness report. GET /v1/grievances/{id} returns a
 * previously recorded adjudication. GET /v1/grievances/student/{id} lists a
 * student's adjudications, oldest first.
 */
@RestController
@RequestMapping("/v1/grievances")
public class GrievanceController {

    private final AdjudicationService adjudicationService;

    public GrievanceController(AdjudicationService adjudicationService) {
        this.adjudicationService = adjudicationService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Adjudication submit(@RequestBody GrievanceSubmission submission) {
        return adjudicationService.adjudicate(submission);
    }

    @GetMapping("/{grievanceId}")
    public Adjudication get(@PathVariable String grievanceId) {
        return adjudicationService.findAdjudication(grievanceId)
            .orElseThrow(() -> new NotFoundException("grievance", grievanceId));
    }

    @GetMapping("/student/{studentId}")
    public Map<String, Object> byStudent(@PathVariable String studentId) {
        List<Adjudication> grievances = adjudicationService.findByStudent(studentId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", grievances.size());
        body.put("grievances", grievances);
        return body;
    }
}
