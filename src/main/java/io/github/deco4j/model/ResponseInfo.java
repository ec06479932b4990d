package io.github.deco4j.model;

/**
 * A documented route response declared with {@code @Response}.
 */
public record ResponseInfo(String code, String description, String type, String example) {
}
