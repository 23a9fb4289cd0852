package com.raceintel.racedata.replay;

import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Delivers replay events as named server-sent events with JSON data.
 */
public class SseReplayEventSink implements ReplayEventSink {

    private final SseEmitter emitter;

    public SseReplayEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(ReplayEvent event) throws IOException {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.type().eventName())
                    .data(event.data(), MediaType.APPLICATION_JSON));
        } catch (IllegalStateException e) {
            // emitter already completed: the client disconnected or timed out
            throw new IOException("SSE emitter closed", e);
        }
    }

    @Override
    public void complete() {
        emitter.complete();
    }
}
