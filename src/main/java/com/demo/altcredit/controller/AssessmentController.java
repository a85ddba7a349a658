package com.demo.altcredit.controller;

import com.demo.altcredit.service.risk.RiskAssessment;
import com.demo.altcredit.service.session.SessionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sessions/{id}/risk")
@RequiredArgsConstructor
public class AssessmentController {

    private final SessionRegistry sessions;

    @PostMapping
    public RiskAssessment compute(@PathVariable("id") String id) {
        return sessions.get(id).computeRisk();
    }

    @GetMapping
    public ResponseEntity<RiskAssessment> last(@PathVariable("id") String id) {
        RiskAssessment a = sessions.get(id).lastAssessment();
        return a == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(a);
    }
}
