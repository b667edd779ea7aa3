package com.bincfa.config;

import com.bincfa.model.Address;
import com.bincfa.model.Region;
import com.bincfa.model.Register;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/default_config.yaml";

    private AnalysisConfig config;

    /**
     * Loads the configuration file, creating it from the bundled template first if it does not exist.
     */
    public void init(File configFile) {
        if (!configFile.exists()) {
            logger.info("Configuration not found. Creating default at: {}", configFile.getAbsolutePath());
            File parent = configFile.getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists()) {
                parent.mkdirs();
            }
            extractDefaultConfig(configFile);
        } else {
            logger.info("Loading configuration: {}", configFile.getAbsolutePath());
        }

        loadConfig(configFile);
    }

    private void extractDefaultConfig(File destination) {
        try (InputStream in = getClass().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new IllegalConfigurationException("Could not find default configuration in resources: " + DEFAULT_CONFIG_RESOURCE);
            }
            Files.copy(in, destination.toPath(), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IllegalConfigurationException("Failed to extract default configuration", e);
        }
    }

    private void loadConfig(File configFile) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try {
            this.config = mapper.readValue(configFile, AnalysisConfig.class);
            if (config.getAnalysis() == null) {
                config.setAnalysis(new AnalysisSettings());
            }
            if (config.getRegisters() == null) {
                config.setRegisters(new ArrayList<>());
            }
            if (config.getRegisterContent() == null) {
                config.setRegisterContent(new LinkedHashMap<>());
            }
            if (config.getMemory() == null) {
                config.setMemory(new MemoryConfig());
            }
            logger.info("Configuration loaded. Architecture: {}, register initializers: {}",
                    config.getAnalysis().getArchitecture(), config.getRegisterContent().size());
        } catch (IOException e) {
            logger.error("Failed to parse configuration file", e);
            throw new IllegalConfigurationException("Configuration load failed: " + configFile, e);
        }
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    /**
     * Resolves register names and parses every content spec of the loaded configuration.
     */
    public InitialConfiguration resolve() {
        return resolve(config);
    }

    public static InitialConfiguration resolve(AnalysisConfig config) {
        AnalysisSettings settings = config.getAnalysis();
        InitialConfiguration resolved = new InitialConfiguration();
        resolved.setAddressSize(settings.getAddressSize());
        resolved.setOperandSize(settings.getOperandSize());
        resolved.setLogLevel(settings.getLogLevel());

        // architecture set first, declarations add to it or override it by name
        Map<String, Register> registers = new LinkedHashMap<>();
        for (Register r : Architecture.fromName(settings.getArchitecture()).registers()) {
            registers.put(r.getName(), r);
        }
        for (RegisterDecl decl : config.getRegisters()) {
            if (decl.getName() == null || decl.getWidth() <= 0) {
                throw new IllegalConfigurationException("Invalid register declaration: " + decl);
            }
            registers.put(decl.getName(), new Register(decl.getName(), decl.getWidth(), decl.isStackPointer()));
        }
        resolved.getRegisters().addAll(registers.values());

        if (settings.getEntrypoint() != null) {
            BigInteger entrypoint = parseAddress(settings.getEntrypoint(), "entrypoint");
            try {
                resolved.setEntrypoint(new Address(Region.GLOBAL, entrypoint, settings.getAddressSize()));
            } catch (IllegalArgumentException e) {
                logger.error("Entrypoint {} does not fit in {} bits", settings.getEntrypoint(), settings.getAddressSize());
                throw new IllegalConfigurationException("Invalid entrypoint: " + e.getMessage(), e);
            }
        }

        for (Map.Entry<String, String> e : config.getRegisterContent().entrySet()) {
            Register r = registers.get(e.getKey());
            if (r == null) {
                logger.error("Initial content given for unknown register {}", e.getKey());
                throw IllegalConfigurationException.forRegister(e.getKey(), "Unknown register " + e.getKey());
            }
            resolved.addRegisterContent(r, ContentSpecParser.parse(e.getValue(), "register " + r.getName()));
        }

        MemoryConfig memory = config.getMemory();
        addMemory(resolved, Region.GLOBAL, memory.getGlobal());
        addMemory(resolved, Region.STACK, memory.getStack());
        addMemory(resolved, Region.HEAP, memory.getHeap());
        return resolved;
    }

    private static void addMemory(InitialConfiguration resolved, Region region, List<MemoryEntry> entries) {
        if (entries == null) return;
        for (MemoryEntry entry : entries) {
            String location = region.name().toLowerCase() + " memory at " + entry.getAddress();
            if (entry.getLength() <= 0) {
                throw new IllegalConfigurationException("Non-positive length for " + location);
            }
            MemoryKey key = new MemoryKey(parseAddress(entry.getAddress(), location), entry.getLength());
            resolved.addMemoryContent(region, key, ContentSpecParser.parse(entry.getContent(), location));
        }
    }

    private static BigInteger parseAddress(String text, String location) {
        if (text == null) {
            throw new IllegalConfigurationException("Missing address for " + location);
        }
        try {
            return ContentSpecParser.parseNumber(text);
        } catch (NumberFormatException e) {
            throw new IllegalConfigurationException("Malformed address for " + location + ": " + text, e);
        }
    }
}
