package com.scifund.api.event;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only access to the ledger event log.
 */
@RestController
@RequestMapping("/api/v1/events")
public class LedgerEventController {

    private final LedgerEventService eventService;

    public LedgerEventController(LedgerEventService eventService) {
        this.eventService = eventService;
    }

    /**
     * GET /api/v1/events?resourceType=Project&resourceId=1
     */
    @GetMapping
    public ResponseEntity<List<LedgerEventService.EventView>> getEvents(
            @RequestParam String resourceType,
            @RequestParam String resourceId) {
        return ResponseEntity.ok(eventService.getEvents(resourceType, resourceId));
    }

    @GetMapping("/recent")
    public ResponseEntity<List<LedgerEventService.EventView>> getRecentEvents() {
        return ResponseEntity.ok(eventService.getRecentEvents());
    }

    @GetMapping("/verify")
    public ResponseEntity<LedgerEventService.ChainVerification> verifyChain() {
        return ResponseEntity.ok(eventService.verifyChain());
    }
}
