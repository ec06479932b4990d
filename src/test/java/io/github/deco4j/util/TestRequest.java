package io.github.deco4j.util;

import io.github.deco4j.runtime.RequestContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link RequestContext} that records the order in which handlers ran.
 */
public final class TestRequest implements RequestContext {

    private final String method;
    private final String path;
    private final Map<String, String> headers = new HashMap<>();
    private final Map<String, Object> attributes = new HashMap<>();
    private final List<String> trace = new ArrayList<>();

    public TestRequest(String method, String path) {
        this.method = method;
        this.path = path;
    }

    public TestRequest header(String name, String value) {
        headers.put(name.toLowerCase(), value);
        return this;
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name.toLowerCase()));
    }

    @Override
    public Map<String, Object> attributes() {
        return attributes;
    }

    /**
     * Appends a step to the execution trace.
     */
    public void record(String step) {
        trace.add(step);
    }

    public List<String> trace() {
        return trace;
    }
}
