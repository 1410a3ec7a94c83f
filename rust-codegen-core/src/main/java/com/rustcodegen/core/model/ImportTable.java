package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Imports of a scope, grouped by path.
 *
 * <p>Insertion order is preserved at both levels. Pushing a name that is already
 * present under the same path keeps the first entry, visibility included. A name
 * such as {@code baz::Baz} is reduced to its first segment, so the imported item is
 * {@code baz} and the remainder is expected at the use site.
 */
public class ImportTable {

    private final Map<String, Map<String, Import>> imports = new LinkedHashMap<>();

    /**
     * Records an import.
     *
     * @param path module path
     * @param name imported name; only the segment before the first {@code ::} is kept
     * @param visibility statement visibility
     * @return this table
     */
    public ImportTable push(String path, String name, Visibility visibility) {
        int separator = name.indexOf("::");
        String imported = separator < 0 ? name : name.substring(0, separator);

        imports.computeIfAbsent(path, key -> new LinkedHashMap<>())
            .putIfAbsent(imported, new Import(path, imported, visibility));
        return this;
    }

    public boolean isEmpty() {
        return imports.isEmpty();
    }

    /**
     * Returns the imported paths in insertion order.
     *
     * @return read-only view of the paths
     */
    public Set<String> paths() {
        return Collections.unmodifiableSet(imports.keySet());
    }

    /**
     * Returns the imports recorded for a path.
     *
     * @param path module path
     * @return imports in insertion order, empty when the path is unknown
     */
    public List<Import> importsOf(String path) {
        Map<String, Import> names = imports.get(path);
        return names == null ? List.of() : List.copyOf(names.values());
    }

    /**
     * Groups the imports into statements.
     *
     * <p>Statements are ordered by visibility first (in the order each visibility was
     * first seen), then by path insertion order.
     *
     * @return consolidated statements
     */
    public List<ImportStatement> consolidate() {
        List<Visibility> visibilities = new ArrayList<>();
        for (Map<String, Import> names : imports.values()) {
            for (Import imported : names.values()) {
                if (!visibilities.contains(imported.visibility())) {
                    visibilities.add(imported.visibility());
                }
            }
        }

        List<ImportStatement> statements = new ArrayList<>();
        for (Visibility visibility : visibilities) {
            for (Map.Entry<String, Map<String, Import>> entry : imports.entrySet()) {
                List<String> names = new ArrayList<>();
                for (Import imported : entry.getValue().values()) {
                    if (imported.visibility().equals(visibility)) {
                        names.add(imported.name());
                    }
                }
                if (!names.isEmpty()) {
                    statements.add(new ImportStatement(visibility, entry.getKey(), names));
                }
            }
        }
        return statements;
    }

    /**
     * Writes every consolidated statement on its own line.
     *
     * @param fmt target formatter
     * @throws IOException if the sink fails
     */
    public void format(Formatter fmt) throws IOException {
        for (ImportStatement statement : consolidate()) {
            statement.format(fmt);
        }
    }
}
