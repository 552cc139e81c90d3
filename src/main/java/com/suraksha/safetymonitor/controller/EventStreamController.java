package com.suraksha.safetymonitor.controller;

import com.suraksha.safetymonitor.config.AuthInterceptor;
import com.suraksha.safetymonitor.exception.ValidationException;
import com.suraksha.safetymonitor.model.BroadcastEnvelope;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.model.Role;
import com.suraksha.safetymonitor.model.Topic;
import com.suraksha.safetymonitor.service.AlertBroadcaster;
import com.suraksha.safetymonitor.service.BroadcastSubscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Server-Sent Events alternative to the STOMP endpoint.
 *
 *   GET /api/events?topics=incident,panic_alert
 *
 * Multiplexes the selected topics (all of them when omitted) over one
 * connection. Each event carries the topic as its name and the broadcast
 * sequence as its id. The stream ends when the client disconnects.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class EventStreamController {

    private final AlertBroadcaster broadcaster;

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @RequestAttribute(AuthInterceptor.ACTOR_ATTRIBUTE) RequestActor actor,
            @RequestParam(required = false) String topics) {
        actor.requireAnyRole(Role.OFFICER, Role.ADMIN);
        Set<Topic> selected = parseTopics(topics);

        SseEmitter emitter = new SseEmitter(0L);
        BroadcastSubscription subscription = broadcaster.subscribe(selected, envelope -> send(emitter, envelope));
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());

        log.info("SSE stream opened for {} — topics {}", actor.getUserId(), selected);
        return emitter;
    }

    private static void send(SseEmitter emitter, BroadcastEnvelope envelope) {
        try {
            emitter.send(SseEmitter.event()
                    .id(String.valueOf(envelope.getSequence()))
                    .name(envelope.getTopic().getCode())
                    .data(envelope.getPayload(), MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            emitter.completeWithError(e);
            throw new UncheckedIOException(e);
        }
    }

    static Set<Topic> parseTopics(String topics) {
        if (topics == null || topics.isBlank()) {
            return EnumSet.allOf(Topic.class);
        }
        Set<Topic> selected = EnumSet.noneOf(Topic.class);
        for (String code : topics.split(",")) {
            if (code.isBlank()) {
                continue;
            }
            selected.add(Topic.fromCode(code.trim())
                    .orElseThrow(() -> new ValidationException("Unknown topic '" + code.trim() + "'")));
        }
        if (selected.isEmpty()) {
            throw new ValidationException("At least one topic is required");
        }
        return selected;
    }
}
