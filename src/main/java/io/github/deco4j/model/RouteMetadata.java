package io.github.deco4j.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Structured description of one annotated handler method.
 *
 * <p>A record is either an HTTP route ({@code method} and {@code path} set) or a
 * websocket-only binding ({@code method} and {@code path} empty, at least one entry
 * in {@code webSocketHandlers}). Instances are immutable; the assembler fills a
 * {@link Builder} and freezes it before hooks and the generator see the result.
 *
 * @param method            HTTP method, or empty for websocket-only records
 * @param path              route path (group prefix already applied), or empty
 * @param functionName      handler method name
 * @param typeName          enclosing type, nested types joined with {@code .}
 * @param packageName       package of the enclosing type, empty for the default package
 * @param fileName          source file name
 * @param line              declaration line
 * @param markers           every marker found on the declaration, in source order
 * @param middlewareCalls   middleware invocations in source order
 * @param middlewareInfo    descriptors matching {@code middlewareCalls} one to one
 * @param description       value of the last {@code @Description}
 * @param summary           value of the last {@code @Summary}
 * @param tags              ordered, duplicate-free tags
 * @param parameters        documented parameters
 * @param responses         documented responses
 * @param group             resolved group, or {@code null}
 * @param webSocketHandlers websocket message types bound to this handler
 */
public record RouteMetadata(String method,
                            String path,
                            String functionName,
                            String typeName,
                            String packageName,
                            String fileName,
                            int line,
                            List<MarkerInstance> markers,
                            List<MiddlewareCall> middlewareCalls,
                            List<MiddlewareInfo> middlewareInfo,
                            String description,
                            String summary,
                            List<String> tags,
                            List<ParameterInfo> parameters,
                            List<ResponseInfo> responses,
                            GroupInfo group,
                            List<String> webSocketHandlers) {

    public RouteMetadata {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(packageName, "packageName");
        markers = List.copyOf(markers);
        middlewareCalls = List.copyOf(middlewareCalls);
        middlewareInfo = List.copyOf(middlewareInfo);
        tags = List.copyOf(tags);
        parameters = List.copyOf(parameters);
        responses = List.copyOf(responses);
        webSocketHandlers = List.copyOf(webSocketHandlers);
    }

    /**
     * Returns {@code true} if this record carries an HTTP method and path.
     */
    public boolean isHttpRoute() {
        return !method.isEmpty() && !path.isEmpty();
    }

    /**
     * Returns {@code true} for a handler that only binds websocket message types.
     */
    public boolean isWebSocketOnly() {
        return !isHttpRoute() && !webSocketHandlers.isEmpty();
    }

    public Optional<GroupInfo> groupInfo() {
        return Optional.ofNullable(group);
    }

    /**
     * Returns the fully qualified name of the handler's enclosing type.
     */
    public String qualifiedTypeName() {
        return packageName.isEmpty() ? typeName : packageName + "." + typeName;
    }

    public static Builder builder(String functionName, String typeName, String packageName) {
        return new Builder(functionName, typeName, packageName);
    }

    /**
     * Mutable accumulator used while markers are reduced into a route record.
     */
    public static final class Builder {
        private final String functionName;
        private final String typeName;
        private final String packageName;
        private String method = "";
        private String path = "";
        private String fileName = "";
        private int line;
        private final List<MarkerInstance> markers = new ArrayList<>();
        private final List<MiddlewareCall> middlewareCalls = new ArrayList<>();
        private final List<MiddlewareInfo> middlewareInfo = new ArrayList<>();
        private String description = "";
        private String summary = "";
        private final Set<String> tags = new LinkedHashSet<>();
        private final List<ParameterInfo> parameters = new ArrayList<>();
        private final List<ResponseInfo> responses = new ArrayList<>();
        private GroupInfo group;
        private final List<String> webSocketHandlers = new ArrayList<>();

        private Builder(String functionName, String typeName, String packageName) {
            this.functionName = Objects.requireNonNull(functionName, "functionName");
            this.typeName = Objects.requireNonNull(typeName, "typeName");
            this.packageName = Objects.requireNonNull(packageName, "packageName");
        }

        public Builder method(String method) {
            this.method = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder path(String path) {
            this.path = Objects.requireNonNull(path, "path");
            return this;
        }

        public String path() {
            return path;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder markers(List<MarkerInstance> markers) {
            this.markers.addAll(markers);
            return this;
        }

        public Builder addMiddleware(MiddlewareCall call, MiddlewareInfo info) {
            middlewareCalls.add(call);
            middlewareInfo.add(info);
            return this;
        }

        public int middlewareCount() {
            return middlewareCalls.size();
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder addTag(String tag) {
            tags.add(tag);
            return this;
        }

        public Builder addParameter(ParameterInfo parameter) {
            parameters.add(parameter);
            return this;
        }

        public Builder addResponse(ResponseInfo response) {
            responses.add(response);
            return this;
        }

        public Builder group(GroupInfo group) {
            this.group = group;
            return this;
        }

        public Builder addWebSocketHandler(String messageType) {
            webSocketHandlers.add(messageType);
            return this;
        }

        public RouteMetadata build() {
            return new RouteMetadata(method, path, functionName, typeName, packageName, fileName, line,
                    markers, middlewareCalls, middlewareInfo, description, summary, new ArrayList<>(tags),
                    parameters, responses, group, webSocketHandlers);
        }
    }
}
