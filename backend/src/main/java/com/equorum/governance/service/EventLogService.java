package com.equorum.governance.service;

import com.equorum.governance.domain.GovernanceEvent;
import com.equorum.governance.dto.EventPage;
import com.equorum.governance.dto.EventResponse;
import com.equorum.governance.repository.GovernanceEventRepository;
import io.micronaut.core.type.Argument;
import io.micronaut.data.model.Pageable;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit log of governance state changes.
 *
 * Every mutating service calls {@link #record} inside its own transaction, so
 * an event exists exactly when the change it describes was committed.
 *
 * Cursor pagination: cursor = base64( id of the last event returned ).
 * Default page size: 20 events, newest first.
 */
@Singleton
public class EventLogService {

    private static final Logger log = LoggerFactory.getLogger(EventLogService.class);
    private static final int DEFAULT_LIMIT = 20;

    @Inject GovernanceEventRepository eventRepository;
    @Inject ObjectMapper objectMapper;
    @Inject Clock clock;

    /**
     * @param type    event type (e.g. "vote_cast")
     * @param actor   principal that triggered the change (nullable for anonymous triggers)
     * @param subject the record changed, e.g. "proposal:12" or "entry:ab12..."
     * @param payload key-value metadata; values must be strings, numbers, booleans or null
     */
    @Transactional
    public void record(String type, String actor, String subject, Map<String, Object> payload) {
        GovernanceEvent event = new GovernanceEvent();
        event.setType(type);
        event.setActor(actor);
        event.setSubject(subject);
        event.setPayload(toJson(payload != null ? payload : Map.of()));
        event.setCreatedAt(clock.instant());
        eventRepository.save(event);
        log.debug("Event[{}] actor={} subject={}", type, actor, subject);
    }

    @Transactional
    public EventPage list(String cursor, Integer limit, String type) {
        int pageSize = (limit != null && limit > 0 && limit <= 100) ? limit : DEFAULT_LIMIT;
        long beforeId = decodeCursor(cursor);

        // one extra row tells whether another page exists
        List<GovernanceEvent> events = eventRepository.findBefore(beforeId, type, Pageable.from(0, pageSize + 1));
        boolean hasMore = events.size() > pageSize;
        if (hasMore) {
            events = events.subList(0, pageSize);
        }
        String nextCursor = hasMore ? encodeCursor(events.get(events.size() - 1).getId()) : null;

        return new EventPage(events.stream().map(this::toResponse).toList(), nextCursor, hasMore);
    }

    @Transactional
    public List<EventResponse> forSubject(String subject) {
        return eventRepository.findBySubjectOrderByIdAsc(subject).stream().map(this::toResponse).toList();
    }

    private EventResponse toResponse(GovernanceEvent e) {
        return new EventResponse(e.getId(), e.getType(), e.getActor(), e.getSubject(),
            fromJson(e.getPayload()), e.getCreatedAt());
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(new LinkedHashMap<>(payload));
        } catch (IOException e) {
            throw new UncheckedIOException("Event payload not serializable", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        try {
            Map<String, Object> map = objectMapper.readValue(json, Argument.mapOf(String.class, Object.class));
            return map != null ? map : Map.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Stored event payload is not valid JSON", e);
        }
    }

    private long decodeCursor(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return Long.MAX_VALUE;
        }
        try {
            return Long.parseLong(new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new HttpStatusException(HttpStatus.BAD_REQUEST, "Invalid cursor: " + cursor);
        }
    }

    private String encodeCursor(long id) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(String.valueOf(id).getBytes(StandardCharsets.UTF_8));
    }
}
