package com.rustcodegen.core.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Scope item. {@code kind} selects which of the remaining properties apply:
 *
 * <ul>
 *   <li>{@code struct} - declaration properties, {@code fields} or {@code tupleFields}</li>
 *   <li>{@code enum} - declaration properties, {@code variants}</li>
 *   <li>{@code trait} - declaration properties, {@code parents}, {@code consts},
 *       {@code types}, {@code functions}</li>
 *   <li>{@code impl} - {@code target}, {@code trait}, {@code generics}, {@code bounds},
 *       {@code macros}, {@code consts}, {@code types}, {@code functions}</li>
 *   <li>{@code function} - {@code function}</li>
 *   <li>{@code type} - declaration properties, {@code target}</li>
 *   <li>{@code module} - {@code name}, {@code doc}, {@code visibility},
 *       {@code attributes}, {@code lints}, {@code scope}</li>
 *   <li>{@code raw} - {@code text}</li>
 *   <li>{@code line-break} - nothing</li>
 * </ul>
 *
 * <p>Declaration properties are {@code name}, {@code doc}, {@code visibility},
 * {@code generics}, {@code bounds}, {@code derives}, {@code lints}, {@code attributes},
 * {@code repr} and {@code macros}.
 */
public record ItemDefinition(
    @JsonProperty("kind") String kind,
    @JsonProperty("name") String name,
    @JsonProperty("doc") String doc,
    @JsonProperty("visibility") String visibility,
    @JsonProperty("generics") List<String> generics,
    @JsonProperty("bounds") List<BoundDefinition> bounds,
    @JsonProperty("derives") List<String> derives,
    @JsonProperty("lints") List<String> lints,
    @JsonProperty("attributes") List<String> attributes,
    @JsonProperty("repr") String repr,
    @JsonProperty("macros") List<String> macros,
    @JsonProperty("fields") List<FieldDefinition> fields,
    @JsonProperty("tupleFields") List<String> tupleFields,
    @JsonProperty("variants") List<VariantDefinition> variants,
    @JsonProperty("parents") List<String> parents,
    @JsonProperty("consts") List<AssociatedDefinition> consts,
    @JsonProperty("types") List<AssociatedDefinition> types,
    @JsonProperty("functions") List<FunctionDefinition> functions,
    @JsonProperty("target") String target,
    @JsonProperty("trait") String implTrait,
    @JsonProperty("function") FunctionDefinition function,
    @JsonProperty("scope") ScopeDefinition scope,
    @JsonProperty("text") String text
) {
    public ItemDefinition {
        generics = generics == null ? List.of() : List.copyOf(generics);
        bounds = bounds == null ? List.of() : List.copyOf(bounds);
        derives = derives == null ? List.of() : List.copyOf(derives);
        lints = lints == null ? List.of() : List.copyOf(lints);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        macros = macros == null ? List.of() : List.copyOf(macros);
        fields = fields == null ? List.of() : List.copyOf(fields);
        tupleFields = tupleFields == null ? List.of() : List.copyOf(tupleFields);
        variants = variants == null ? List.of() : List.copyOf(variants);
        parents = parents == null ? List.of() : List.copyOf(parents);
        consts = consts == null ? List.of() : List.copyOf(consts);
        types = types == null ? List.of() : List.copyOf(types);
        functions = functions == null ? List.of() : List.copyOf(functions);
        if (scope == null) {
            scope = ScopeDefinition.empty();
        }
    }
}
