package com.rustcodegen.core.definition;

import com.rustcodegen.core.file.Library;
import com.rustcodegen.core.file.LibraryCodegenException;
import com.rustcodegen.core.file.SourceFile;
import com.rustcodegen.core.model.AssociatedConst;
import com.rustcodegen.core.model.AssociatedType;
import com.rustcodegen.core.model.Block;
import com.rustcodegen.core.model.Bound;
import com.rustcodegen.core.model.Enumeration;
import com.rustcodegen.core.model.Field;
import com.rustcodegen.core.model.Function;
import com.rustcodegen.core.model.Impl;
import com.rustcodegen.core.model.Lint;
import com.rustcodegen.core.model.Module;
import com.rustcodegen.core.model.Scope;
import com.rustcodegen.core.model.SelfArg;
import com.rustcodegen.core.model.Struct;
import com.rustcodegen.core.model.Trait;
import com.rustcodegen.core.model.TypeAlias;
import com.rustcodegen.core.model.TypeDef;
import com.rustcodegen.core.model.Variant;
import com.rustcodegen.core.model.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns definitions into scope and library builders.
 *
 * <p>Misuse the builders reject while items are pushed, such as mixing tuple and named
 * fields or repeating a module name, is reported as {@link DefinitionException} with
 * the offending item. Problems that only surface when rendering, such as a function
 * without body outside a trait, are left to the renderer.
 */
public class ScopeAssembler {

    private static final Logger log = LoggerFactory.getLogger(ScopeAssembler.class);

    private static final Pattern LINT = Pattern.compile("([a-z-]+)\\((.+)\\)");

    /**
     * Builds a library.
     *
     * @param definition library definition
     * @param defaultDirectory parent directory used when the definition has no path;
     *        the library is placed in a subdirectory named after it
     * @return library ready to render or generate
     * @throws DefinitionException if the definition is invalid
     */
    public Library assembleLibrary(LibraryDefinition definition, Path defaultDirectory) throws DefinitionException {
        Path path = definition.path() != null
            ? Path.of(definition.path())
            : defaultDirectory.resolve(definition.name());

        Library library = new Library(definition.name(), path);
        library.getLib().setScope(assembleScope(definition.lib()));

        for (FileDefinition file : definition.files()) {
            if (file.path() == null || file.path().isBlank()) {
                throw new DefinitionException("File of library '" + definition.name() + "' has no path");
            }
            try {
                library.pushFile(new SourceFile(Path.of(file.path()), assembleScope(file.scope())));
            } catch (LibraryCodegenException e) {
                throw new DefinitionException("Duplicate file in library '" + definition.name() + "': " + e.getPath(), e);
            }
        }

        log.debug("Assembled library '{}' with {} files into {}", library.getName(), definition.files().size() + 1, path);
        return library;
    }

    /**
     * Builds a scope.
     *
     * @param definition scope definition
     * @return populated scope
     * @throws DefinitionException if an item is invalid
     */
    public Scope assembleScope(ScopeDefinition definition) throws DefinitionException {
        Scope scope = new Scope();
        populate(scope, definition);
        return scope;
    }

    private void populate(Scope scope, ScopeDefinition definition) throws DefinitionException {
        scope.setDoc(definition.doc());

        for (ImportDefinition imported : definition.imports()) {
            if (imported.path() == null || imported.allNames().isEmpty()) {
                throw new DefinitionException("Import needs a path and at least one name: " + imported);
            }
            Visibility visibility = Visibility.of(imported.visibility());
            for (String name : imported.allNames()) {
                scope.pushImport(imported.path(), name, visibility);
            }
        }

        for (ItemDefinition item : definition.items()) {
            try {
                pushItem(scope, item);
            } catch (IllegalStateException | IllegalArgumentException e) {
                throw new DefinitionException("Invalid " + item.kind() + " '" + item.name() + "': " + e.getMessage(), e);
            }
        }
    }

    private void pushItem(Scope scope, ItemDefinition item) throws DefinitionException {
        if (item.kind() == null) {
            throw new DefinitionException("Item without kind: " + item.name());
        }

        switch (item.kind()) {
            case "struct" -> scope.pushStruct(struct(item));
            case "enum" -> scope.pushEnum(enumeration(item));
            case "trait" -> scope.pushTrait(trait(item));
            case "impl" -> scope.pushImpl(impl(item));
            case "function" -> {
                if (item.function() == null) {
                    throw new DefinitionException("Function item without function: " + item.name());
                }
                scope.pushFunction(function(item.function()));
            }
            case "type" -> {
                TypeAlias alias = new TypeAlias(requireName(item), require(item.target(), "target", item));
                scope.pushTypeAlias(declaration(alias, item));
            }
            case "module" -> scope.pushModule(module(item));
            case "raw" -> scope.raw(require(item.text(), "text", item));
            case "line-break" -> scope.pushLineBreak();
            default -> throw new DefinitionException("Unknown item kind '" + item.kind() + "'");
        }
    }

    private Struct struct(ItemDefinition item) throws DefinitionException {
        Struct struct = declaration(new Struct(requireName(item)), item);
        for (FieldDefinition field : item.fields()) {
            struct.pushNamedField(field(field));
        }
        for (String type : item.tupleFields()) {
            struct.pushTupleField(type);
        }
        return struct;
    }

    private Enumeration enumeration(ItemDefinition item) throws DefinitionException {
        Enumeration enumeration = declaration(new Enumeration(requireName(item)), item);
        for (VariantDefinition definition : item.variants()) {
            if (definition.name() == null) {
                throw new DefinitionException("Variant without name in enum " + item.name());
            }
            Variant variant = enumeration.newVariant(definition.name());
            definition.annotations().forEach(variant::pushAnnotation);
            for (FieldDefinition field : definition.fields()) {
                variant.pushNamedField(field(field));
            }
            definition.tupleFields().forEach(variant::pushTupleField);
        }
        return enumeration;
    }

    private Trait trait(ItemDefinition item) throws DefinitionException {
        Trait trait = declaration(new Trait(requireName(item)), item);
        item.parents().forEach(trait::pushParent);

        for (AssociatedDefinition constant : item.consts()) {
            trait.pushAssociatedConst(new AssociatedConst(
                require(constant.name(), "const name", item),
                require(constant.type(), "const type", item)));
        }
        for (AssociatedDefinition type : item.types()) {
            trait.pushAssociatedType(new AssociatedType(require(type.name(), "type name", item), type.bounds()));
        }
        for (FunctionDefinition function : item.functions()) {
            trait.pushFunction(function(function));
        }
        return trait;
    }

    private Impl impl(ItemDefinition item) throws DefinitionException {
        Impl impl = new Impl(require(item.target(), "target", item));
        impl.setImplTrait(item.implTrait());
        item.generics().forEach(impl::pushGeneric);
        item.macros().forEach(impl::pushMacro);
        for (BoundDefinition bound : item.bounds()) {
            impl.pushBound(bound(bound));
        }

        for (AssociatedDefinition constant : item.consts()) {
            impl.pushAssociatedConst(new AssociatedConst(
                    require(constant.name(), "const name", item),
                    require(constant.type(), "const type", item))
                .setConcreteValue(constant.value())
                .setConcreteVisibility(Visibility.of(constant.visibility())));
        }
        for (AssociatedDefinition type : item.types()) {
            AssociatedType associated = new AssociatedType(require(type.name(), "type name", item));
            if (type.concrete() != null) {
                associated.setConcreteType(type.concrete(), type.generics());
            }
            impl.pushAssociatedType(associated);
        }
        for (FunctionDefinition function : item.functions()) {
            impl.pushFunction(function(function));
        }
        return impl;
    }

    private Module module(ItemDefinition item) throws DefinitionException {
        Module module = new Module(requireName(item))
            .setDoc(item.doc())
            .setVisibility(Visibility.of(item.visibility()));
        item.attributes().forEach(module::pushAttribute);
        for (String lint : item.lints()) {
            module.pushLint(lint(lint));
        }
        populate(module.getScope(), item.scope());
        return module;
    }

    Function function(FunctionDefinition definition) throws DefinitionException {
        if (definition.name() == null) {
            throw new DefinitionException("Function without name");
        }

        Function function = new Function(definition.name())
            .setDoc(definition.doc())
            .setVisibility(Visibility.of(definition.visibility()))
            .setAsync(definition.async())
            .setSelfArg(selfArg(definition.self()))
            .setRet(definition.returns())
            .setExternAbi(definition.externAbi());

        definition.generics().forEach(function::pushGeneric);
        definition.attributes().forEach(function::pushAttribute);
        for (String lint : definition.lints()) {
            function.pushLint(lint(lint));
        }
        for (FieldDefinition arg : definition.args()) {
            Field field = field(arg);
            function.pushArg(field.getName(), field.getType());
        }
        for (BoundDefinition bound : definition.bounds()) {
            function.pushBound(bound(bound));
        }

        for (Object entry : definition.body()) {
            if (entry instanceof String line) {
                function.pushLine(line);
            } else {
                function.pushBlock(block(entry, definition.name()));
            }
        }
        return function;
    }

    private Block block(Object entry, String functionName) throws DefinitionException {
        if (!(entry instanceof Map<?, ?> map) || map.size() != 1 || !(map.get("block") instanceof List<?> entries)) {
            throw new DefinitionException("Body entries of " + functionName + " must be lines or 'block' lists: " + entry);
        }

        Block block = new Block();
        for (Object nested : entries) {
            if (nested instanceof String line) {
                block.pushLine(line);
            } else {
                block.pushBlock(block(nested, functionName));
            }
        }
        return block;
    }

    private <T extends TypeDef<T>> T declaration(T declaration, ItemDefinition item) throws DefinitionException {
        declaration.setDoc(item.doc())
            .setVisibility(Visibility.of(item.visibility()))
            .setRepr(item.repr());
        item.generics().forEach(declaration::pushGeneric);
        item.derives().forEach(declaration::pushDerive);
        item.attributes().forEach(declaration::pushAttribute);
        item.macros().forEach(declaration::pushMacro);
        for (String lint : item.lints()) {
            declaration.pushLint(lint(lint));
        }
        for (BoundDefinition bound : item.bounds()) {
            declaration.pushBound(bound(bound));
        }
        return declaration;
    }

    private static Field field(FieldDefinition definition) throws DefinitionException {
        if (definition.name() == null || definition.type() == null) {
            throw new DefinitionException("Field needs a name and a type: " + definition);
        }
        Field field = new Field(definition.name(), definition.type())
            .setDoc(definition.doc())
            .setVisibility(Visibility.of(definition.visibility()));
        definition.annotations().forEach(field::pushAnnotation);
        return field;
    }

    private static Bound bound(BoundDefinition definition) throws DefinitionException {
        if (definition.name() == null) {
            throw new DefinitionException("Bound without name: " + definition);
        }
        return new Bound(definition.name(), definition.traits());
    }

    /**
     * Parses a lint written as {@code level(name)}, e.g. {@code allow(dead_code)}.
     */
    static Lint lint(String text) throws DefinitionException {
        Matcher matcher = LINT.matcher(text.trim());
        if (!matcher.matches()) {
            throw new DefinitionException("Invalid lint '" + text + "', expected level(name)");
        }
        for (Lint.Level level : Lint.Level.values()) {
            if (level.attribute().equals(matcher.group(1))) {
                return new Lint(level, matcher.group(2));
            }
        }
        throw new DefinitionException("Unknown lint level '" + matcher.group(1) + "'");
    }

    static SelfArg selfArg(String text) throws DefinitionException {
        if (text == null || text.isBlank()) {
            return SelfArg.NONE;
        }
        for (SelfArg selfArg : SelfArg.values()) {
            if (selfArg != SelfArg.NONE && selfArg.text().equals(text.trim())) {
                return selfArg;
            }
        }
        throw new DefinitionException("Unknown self argument '" + text + "'");
    }

    private static String requireName(ItemDefinition item) throws DefinitionException {
        return require(item.name(), "name", item);
    }

    private static String require(String value, String property, ItemDefinition item) throws DefinitionException {
        if (value == null) {
            throw new DefinitionException(item.kind() + " item '" + item.name() + "' has no " + property);
        }
        return value;
    }
}
