package com.rustcodegen.core.definition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads library definitions from YAML.
 *
 * <p>Unlike configuration, definitions have no defaults: a missing file, malformed
 * YAML, an unknown property or a library without a name is an error.
 */
public class DefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(DefinitionLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DefinitionLoader() {
    }

    /**
     * Loads a definition file.
     *
     * @param definitionPath path to the YAML document
     * @return parsed definition
     * @throws DefinitionException if the file is unreadable or invalid
     */
    public static LibraryDefinition load(Path definitionPath) throws DefinitionException {
        if (!Files.isRegularFile(definitionPath) || !Files.isReadable(definitionPath)) {
            throw new DefinitionException("Definition file not found or not readable: " + definitionPath);
        }

        log.debug("Loading definition from: {}", definitionPath);
        LibraryDefinition definition;
        try {
            definition = YAML_MAPPER.readValue(definitionPath.toFile(), LibraryDefinition.class);
        } catch (IOException e) {
            throw new DefinitionException("Invalid definition file " + definitionPath + ": " + e.getMessage(), e);
        }

        if (definition == null || definition.name() == null || definition.name().isBlank()) {
            throw new DefinitionException("Definition file " + definitionPath + " does not name a library");
        }

        log.info("Loaded definition of library '{}' with {} files from {}",
            definition.name(), definition.files().size() + 1, definitionPath);
        return definition;
    }
}
