package com.bincfa.config;

import com.bincfa.model.Address;
import com.bincfa.model.DecodingContext;
import com.bincfa.model.Region;
import com.bincfa.model.Register;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resolved configuration consumed by the state initializer: register set, register
 * initializers and the Global/Stack/Heap memory tables, with every spec already parsed.
 */
@Data
public class InitialConfiguration {
    private int addressSize = 32;
    private int operandSize = 32;
    private int logLevel = 2;
    private Address entrypoint;

    private List<Register> registers = new ArrayList<>();
    private Map<Register, InitialSpec> registerContent = new LinkedHashMap<>();
    private Map<Region, Map<MemoryKey, InitialSpec>> memoryContent = new EnumMap<>(Region.class);

    public DecodingContext decodingContext() {
        return new DecodingContext(addressSize, operandSize);
    }

    /**
     * @return the content table of the region, ordered by address then length
     */
    public Map<MemoryKey, InitialSpec> memoryContent(Region region) {
        return memoryContent.computeIfAbsent(region, r -> new TreeMap<>());
    }

    public InitialConfiguration addRegisterContent(Register register, InitialSpec spec) {
        registerContent.put(register, spec);
        return this;
    }

    public InitialConfiguration addMemoryContent(Region region, MemoryKey key, InitialSpec spec) {
        memoryContent(region).put(key, spec);
        return this;
    }
}
