package com.histora.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.histora.service.core.datastore.ConfigStoreFacade;
import com.histora.service.core.datastore.DatastoreValue;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/datastore", produces = MediaType.APPLICATION_JSON_VALUE)
public class DatastoreController {

    private final ConfigStoreFacade store;

    public DatastoreController(ConfigStoreFacade store) {
        this.store = store;
    }

    @GetMapping("/ping")
    public Map<String, String> ping() {
        store.ping();
        return Map.of("ping", "pong");
    }

    @GetMapping
    public ValuesResponse mget(
            @RequestParam(defaultValue = "") String namespace,
            @RequestParam(required = false) List<String> ids,
            @RequestParam(required = false) String filter) {
        return new ValuesResponse(store.mget(namespace, ids, filter));
    }

    @GetMapping("/{id}")
    public ValueResponse get(@PathVariable String id, @RequestParam(defaultValue = "") String namespace) {
        return new ValueResponse(store.get(namespace, id).orElse(null));
    }

    @PutMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ValueResponse set(
            @PathVariable String id,
            @RequestParam(required = false) String namespace,
            @RequestBody DatastoreValue value) {
        value.setId(id);
        if (namespace != null) {
            value.setNamespace(namespace);
        }
        return new ValueResponse(store.set(value));
    }

    @DeleteMapping("/{id}")
    public CountResponse delete(@PathVariable String id, @RequestParam(defaultValue = "") String namespace) {
        return new CountResponse(store.delete(namespace, id));
    }

    @PostMapping(path = "/mset", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ValuesResponse mset(@RequestBody ValuesRequest request) {
        return new ValuesResponse(store.mset(request.values() == null ? List.of() : request.values()));
    }

    @PostMapping(path = "/mdelete", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CountResponse mdelete(@RequestBody SelectionRequest request) {
        return new CountResponse(store.mdelete(request.namespace(), request.ids(), request.filter()));
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record ValueResponse(DatastoreValue value) {}

    public record ValuesResponse(List<DatastoreValue> values) {}

    public record ValuesRequest(List<DatastoreValue> values) {}

    public record SelectionRequest(String namespace, List<String> ids, String filter) {}

    public record CountResponse(int count) {}
}
