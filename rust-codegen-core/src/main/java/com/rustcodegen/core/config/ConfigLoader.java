package com.rustcodegen.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Loads {@code rust-codegen.yaml}.
 *
 * <p>Configuration never stops a run: a missing, empty or unparsable file yields
 * {@link CodegenConfig#defaults()}. Unknown top-level sections are reported and
 * ignored. An output directory that names an existing regular file is replaced by
 * the default, since no library could be written there.
 */
public class ConfigLoader {

    /** Configuration file looked up in the working directory when none is given. */
    public static final String DEFAULT_FILE_NAME = "rust-codegen.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> SECTIONS = Set.of("output", "console");

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code rust-codegen.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CodegenConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return CodegenConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CodegenConfig.defaults();
        }

        JsonNode root;
        CodegenConfig config;
        try {
            log.debug("Loading configuration from: {}", configPath);
            root = YAML_MAPPER.readTree(configPath.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CodegenConfig.defaults();
            }
            if (!root.isObject()) {
                log.warn("Configuration file {} must hold a mapping, found {}. Using defaults.",
                    configPath, root.getNodeType());
                return CodegenConfig.defaults();
            }
            config = YAML_MAPPER.treeToValue(root, CodegenConfig.class);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CodegenConfig.defaults();
        }

        List<String> unknown = new ArrayList<>();
        root.fieldNames().forEachRemaining(name -> {
            if (!SECTIONS.contains(name)) {
                unknown.add(name);
            }
        });
        if (!unknown.isEmpty()) {
            log.warn("Ignoring unknown sections {} in {}", unknown, configPath);
        }

        log.info("Loaded configuration from: {}", configPath);
        return checkOutputDirectory(config, configPath);
    }

    private static CodegenConfig checkOutputDirectory(CodegenConfig config, Path configPath) {
        String directory = config.output().directory();
        try {
            if (!Files.isRegularFile(Path.of(directory))) {
                return config;
            }
            log.warn("Output directory {} in {} is a file. Using {}.",
                directory, configPath, CodegenConfig.DEFAULT_OUTPUT_DIRECTORY);
        } catch (InvalidPathException e) {
            log.warn("Output directory '{}' in {} is not a valid path. Using {}.",
                directory, configPath, CodegenConfig.DEFAULT_OUTPUT_DIRECTORY);
        }
        return new CodegenConfig(CodegenConfig.OutputConfig.defaults(), config.console());
    }
}
