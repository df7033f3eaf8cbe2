package com.histora.controller.rest;

import com.histora.service.core.relay.EventRelay;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Runtime management of the bus topics relayed into history. */
@RestController
@RequestMapping(path = "/api/relay/topics", produces = MediaType.APPLICATION_JSON_VALUE)
public class RelayTopicsController {

    private final EventRelay relay;

    public RelayTopicsController(EventRelay relay) {
        this.relay = relay;
    }

    @GetMapping
    public EventRelay.Snapshot topics() {
        return relay.snapshot();
    }

    @PutMapping("/{topic}")
    public TopicChange subscribe(@PathVariable String topic) {
        return new TopicChange(topic, relay.subscribe(topic));
    }

    @DeleteMapping("/{topic}")
    public TopicChange unsubscribe(@PathVariable String topic) {
        return new TopicChange(topic, relay.unsubscribe(topic));
    }

    public record TopicChange(String topic, boolean changed) {}
}
