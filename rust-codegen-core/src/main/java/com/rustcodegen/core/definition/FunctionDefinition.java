package com.rustcodegen.core.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Function, method or trait member.
 *
 * <p>Body entries are either strings, written as lines, or single-key maps
 * {@code block: [...]} holding the entries of a nested brace block:
 * <pre>{@code
 * body:
 *   - "for x in xs"
 *   - block:
 *       - "println!(\"{}\", x);"
 * }</pre>
 *
 * @param name function name
 * @param doc documentation
 * @param visibility visibility; must be absent for trait members
 * @param async whether the function is {@code async}
 * @param generics generic parameters
 * @param self receiver: {@code self}, {@code &self}, {@code mut self} or {@code &mut self}
 * @param args arguments after the receiver
 * @param returns return type
 * @param bounds {@code where} clause
 * @param attributes attributes without brackets
 * @param lints lints such as {@code allow(dead_code)}
 * @param externAbi ABI of an {@code extern} function
 * @param body body entries; empty only for trait members
 */
public record FunctionDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("doc") String doc,
    @JsonProperty("visibility") String visibility,
    @JsonProperty("async") boolean async,
    @JsonProperty("generics") List<String> generics,
    @JsonProperty("self") String self,
    @JsonProperty("args") List<FieldDefinition> args,
    @JsonProperty("returns") String returns,
    @JsonProperty("bounds") List<BoundDefinition> bounds,
    @JsonProperty("attributes") List<String> attributes,
    @JsonProperty("lints") List<String> lints,
    @JsonProperty("externAbi") String externAbi,
    @JsonProperty("body") List<Object> body
) {
    public FunctionDefinition {
        generics = generics == null ? List.of() : List.copyOf(generics);
        args = args == null ? List.of() : List.copyOf(args);
        bounds = bounds == null ? List.of() : List.copyOf(bounds);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        lints = lints == null ? List.of() : List.copyOf(lints);
        body = body == null ? List.of() : List.copyOf(body);
    }
}
