package io.github.deco4j.runtime;

import io.github.deco4j.model.GroupInfo;
import io.github.deco4j.model.MiddlewareInfo;
import io.github.deco4j.model.ParameterInfo;
import io.github.deco4j.model.ResponseInfo;

import java.util.List;
import java.util.Objects;

/**
 * A route registration issued by generated code: the handler, its middleware chain
 * and all documentation metadata resolved at generation time.
 *
 * <p>Generated code builds entries through {@link #builder(String, String, Handler)}.
 */
public record RouteEntry(String method,
                         String path,
                         Handler handler,
                         List<Middleware> middlewares,
                         String funcName,
                         String packageName,
                         String fileName,
                         String description,
                         String summary,
                         List<String> tags,
                         List<MiddlewareInfo> middlewareInfo,
                         List<ParameterInfo> parameters,
                         GroupInfo group,
                         List<ResponseInfo> responses,
                         List<String> webSocketHandlers) {

    public RouteEntry {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(handler, "handler");
        middlewares = List.copyOf(middlewares);
        tags = List.copyOf(tags);
        middlewareInfo = List.copyOf(middlewareInfo);
        parameters = List.copyOf(parameters);
        responses = List.copyOf(responses);
        webSocketHandlers = List.copyOf(webSocketHandlers);
    }

    /**
     * Returns the handler wrapped by the middleware chain, first middleware outermost.
     */
    public Handler composedHandler() {
        Handler composed = handler;
        for (int i = middlewares.size() - 1; i >= 0; i--) {
            composed = middlewares.get(i).wrap(composed);
        }
        return composed;
    }

    public static Builder builder(String method, String path, Handler handler) {
        return new Builder(method, path, handler);
    }

    public static final class Builder {
        private final String method;
        private final String path;
        private final Handler handler;
        private List<Middleware> middlewares = List.of();
        private String funcName = "";
        private String packageName = "";
        private String fileName = "";
        private String description = "";
        private String summary = "";
        private List<String> tags = List.of();
        private List<MiddlewareInfo> middlewareInfo = List.of();
        private List<ParameterInfo> parameters = List.of();
        private GroupInfo group;
        private List<ResponseInfo> responses = List.of();
        private List<String> webSocketHandlers = List.of();

        private Builder(String method, String path, Handler handler) {
            this.method = method;
            this.path = path;
            this.handler = handler;
        }

        public Builder middlewares(List<Middleware> middlewares) {
            this.middlewares = middlewares;
            return this;
        }

        public Builder funcName(String funcName) {
            this.funcName = funcName;
            return this;
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder middlewareInfo(List<MiddlewareInfo> middlewareInfo) {
            this.middlewareInfo = middlewareInfo;
            return this;
        }

        public Builder parameters(List<ParameterInfo> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder group(GroupInfo group) {
            this.group = group;
            return this;
        }

        public Builder responses(List<ResponseInfo> responses) {
            this.responses = responses;
            return this;
        }

        public Builder webSocketHandlers(List<String> webSocketHandlers) {
            this.webSocketHandlers = webSocketHandlers;
            return this;
        }

        public RouteEntry build() {
            return new RouteEntry(method, path, handler, middlewares, funcName, packageName, fileName,
                    description, summary, tags, middlewareInfo, parameters, group, responses, webSocketHandlers);
        }
    }
}
