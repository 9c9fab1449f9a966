package com.scifund.api.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.scifund.core.domain.LedgerEvent;
import com.scifund.core.domain.LedgerEvent.EventType;
import com.scifund.core.repository.LedgerEventRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Append-only, hash-chained log of ledger state changes.
 * Appends happen inside the ledger gate, so the chain head cannot move under us.
 */
@Service
public class LedgerEventService {

    private final LedgerEventRepository eventRepository;
    private final ObjectWriter detailsWriter;
    private final Clock clock;

    public LedgerEventService(LedgerEventRepository eventRepository, ObjectMapper objectMapper, Clock clock) {
        this.eventRepository = eventRepository;
        this.detailsWriter = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEvent append(
            EventType eventType,
            String actorId,
            String resourceType,
            Object resourceId,
            Map<String, ?> details) {

        String previousHash = eventRepository.findTopByOrderByIdDesc()
                .map(LedgerEvent::getEventHash)
                .orElse(LedgerEvent.GENESIS);

        // database timestamps keep microseconds
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        LedgerEvent event = LedgerEvent.create(
                eventType,
                actorId,
                resourceType,
                String.valueOf(resourceId),
                toJson(details),
                previousHash,
                now
        );
        event.setEventHash(computeHash(event));
        return eventRepository.save(event);
    }

    /**
     * Walks the whole log from the first event and checks every link and hash.
     */
    @Transactional(readOnly = true)
    public ChainVerification verifyChain() {
        String expectedPrevious = LedgerEvent.GENESIS;
        long count = 0;
        for (LedgerEvent event : eventRepository.findAllByOrderByIdAsc()) {
            count++;
            boolean linked = expectedPrevious.equals(event.getPreviousHash());
            boolean intact = computeHash(event).equals(event.getEventHash());
            if (!linked || !intact) {
                return new ChainVerification(count, false, event.getId());
            }
            expectedPrevious = event.getEventHash();
        }
        return new ChainVerification(count, true, null);
    }

    @Transactional(readOnly = true)
    public List<EventView> getEvents(String resourceType, String resourceId) {
        return eventRepository.findByResourceTypeAndResourceIdOrderByIdAsc(resourceType, resourceId).stream()
                .map(LedgerEventService::toView)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<EventView> getRecentEvents() {
        return eventRepository.findTop50ByOrderByIdDesc().stream()
                .map(LedgerEventService::toView)
                .toList();
    }

    private String toJson(Map<String, ?> details) {
        try {
            return detailsWriter.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event details", e);
        }
    }

    static String computeHash(LedgerEvent event) {
        return LedgerHashes.sha256(
                event.getEventType().name(),
                event.getOccurredAt().toString(),
                event.getActorId(),
                event.getResourceType(),
                event.getResourceId(),
                event.getDetails() == null ? "" : event.getDetails(),
                event.getPreviousHash()
        );
    }

    private static EventView toView(LedgerEvent event) {
        return new EventView(
                event.getId(),
                event.getEventType().name(),
                event.getOccurredAt(),
                event.getActorId(),
                event.getResourceType(),
                event.getResourceId(),
                event.getDetails(),
                event.getPreviousHash(),
                event.getEventHash()
        );
    }

    public record EventView(
            Long id,
            String eventType,
            Instant occurredAt,
            String actorId,
            String resourceType,
            String resourceId,
            String details,
            String previousHash,
            String eventHash
    ) {}

    public record ChainVerification(long eventCount, boolean valid, Long firstBrokenEventId) {}
}
