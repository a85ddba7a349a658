package com.demo.altcredit.controller;

import com.demo.altcredit.controller.dto.ConsentDtos;
import com.demo.altcredit.service.consent.ConsentPrompt;
import com.demo.altcredit.service.session.CollectionSession;
import com.demo.altcredit.service.session.SessionRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * The client shows the consent dialog itself and posts the user's answer here; the answer
 * is fed to the gate as the prompt's result.
 */
@RestController
@RequestMapping("/api/sessions/{id}/consent")
@RequiredArgsConstructor
public class ConsentController {

    private final SessionRegistry sessions;

    @PostMapping
    public ConsentDtos.StatusResponse request(@PathVariable("id") String id,
                                              @Valid @RequestBody ConsentDtos.GrantRequest body) {
        CollectionSession s = sessions.get(id);
        s.requestConsent(body.purpose, body.explanation, body.force, ConsentPrompt.answered(body.decision)).join();
        return ConsentDtos.StatusResponse.of(s.consent());
    }

    @GetMapping
    public ConsentDtos.StatusResponse status(@PathVariable("id") String id) {
        return ConsentDtos.StatusResponse.of(sessions.get(id).consent());
    }

    @DeleteMapping
    public ConsentDtos.StatusResponse revoke(@PathVariable("id") String id) {
        CollectionSession s = sessions.get(id);
        s.revoke();
        return ConsentDtos.StatusResponse.of(s.consent());
    }
}
