package com.demo.altcredit.controller;

import com.demo.altcredit.controller.dto.ReportedSignalsRequest;
import com.demo.altcredit.controller.dto.SessionDtos;
import com.demo.altcredit.service.collect.CompositeProfile;
import com.demo.altcredit.service.session.CollectionSession;
import com.demo.altcredit.service.session.SessionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionRegistry sessions;

    @PostMapping
    public SessionDtos.SessionResponse open(@RequestBody(required = false) SessionDtos.OpenRequest body) {
        CollectionSession s = (body == null || body.sessionId == null || body.sessionId.isBlank())
                ? sessions.open()
                : sessions.open(body.sessionId);
        return SessionDtos.SessionResponse.of(s);
    }

    @GetMapping("/{id}")
    public SessionDtos.SessionResponse get(@PathVariable("id") String id) {
        return SessionDtos.SessionResponse.of(sessions.get(id));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> close(@PathVariable("id") String id) {
        sessions.close(id);
        return Map.of("ok", true, "sessionId", id);
    }

    @PostMapping("/{id}/signals")
    public Map<String, Object> reportSignals(@PathVariable("id") String id, @RequestBody ReportedSignalsRequest body) {
        sessions.get(id).reportSignals(body.toSignals());
        return Map.of("ok", true);
    }

    // Without consent the cycle still runs and every source reports permission_denied
    @PostMapping("/{id}/collection")
    public CompositeProfile collect(@PathVariable("id") String id) {
        return sessions.get(id).collectAll();
    }

    @GetMapping("/{id}/profile")
    public ResponseEntity<CompositeProfile> profile(@PathVariable("id") String id) {
        CompositeProfile p = sessions.get(id).profile();
        return p == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(p);
    }

    @GetMapping("/{id}/refresher")
    public Map<String, Object> refresher(@PathVariable("id") String id) {
        CollectionSession s = sessions.get(id);
        return Map.of("state", s.refresherState(), "cycleRunning", s.getOrchestrator().isCycleRunning());
    }
}
