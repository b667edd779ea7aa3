package com.bincfa.analysis;

import com.bincfa.config.IllegalConfigurationException;
import com.bincfa.config.InitialConfiguration;
import com.bincfa.config.InitialContent;
import com.bincfa.config.InitialSpec;
import com.bincfa.config.InitialTaint;
import com.bincfa.config.MemoryKey;
import com.bincfa.domain.Domain;
import com.bincfa.graph.Cfa;
import com.bincfa.graph.State;
import com.bincfa.model.Address;
import com.bincfa.model.Region;
import com.bincfa.model.Register;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Builds the abstract value of the root state from the configuration.
 * <p>
 * Every register is added to an empty value, then register initializers are applied (after
 * checking they fit in the register), then Global, Stack and Heap memory tables in that order.
 * The stack pointer is seeded in the Stack region, every other register in the Global one.
 */
public class CfaInitializer<D> {
    private static final Logger logger = LoggerFactory.getLogger(CfaInitializer.class);

    private final Domain<D> domain;
    private final InitialConfiguration config;

    public CfaInitializer(Domain<D> domain, InitialConfiguration config) {
        this.domain = domain;
        this.config = config;
    }

    /**
     * @throws IllegalConfigurationException if an initializer does not fit its register, or a
     *                                       byte pattern is given for a register
     */
    public D initAbstractValue() {
        D d = domain.init();
        for (Register r : config.getRegisters()) {
            d = domain.addRegister(r, d);
        }
        d = initRegisters(d);
        d = initMemory(d, Region.GLOBAL);
        d = initMemory(d, Region.STACK);
        return initMemory(d, Region.HEAP);
    }

    /**
     * Seeds the root state of {@code cfa} at {@code ip} with the configured value and decoding context.
     */
    public State<D> initState(Cfa<D> cfa, Address ip) {
        D value = initAbstractValue();
        State<D> root = cfa.initState(ip, value, config.decodingContext());
        logger.info("Root state seeded at {} ({} registers, {} register initializers)",
                ip, config.getRegisters().size(), config.getRegisterContent().size());
        return root;
    }

    /**
     * Seeds the root state at the configured entrypoint.
     */
    public State<D> initState(Cfa<D> cfa) {
        if (config.getEntrypoint() == null) {
            throw new IllegalConfigurationException("No entrypoint configured");
        }
        return initState(cfa, config.getEntrypoint());
    }

    D initRegisters(D d) {
        // sorted by name: map order must not leak into the result
        List<Map.Entry<Register, InitialSpec>> entries = new ArrayList<>(config.getRegisterContent().entrySet());
        entries.sort(Comparator.comparing(e -> e.getKey().getName()));
        for (Map.Entry<Register, InitialSpec> e : entries) {
            Register r = e.getKey();
            InitialSpec spec = e.getValue();
            checkInitSize(r, spec);
            Region region = r.isStackPointer() ? Region.STACK : Region.GLOBAL;
            d = domain.setRegisterFromConfig(r, region, spec.getContent(), spec.getTaint(), d);
        }
        return d;
    }

    D initMemory(D d, Region region) {
        for (Map.Entry<MemoryKey, InitialSpec> e : config.memoryContent(region).entrySet()) {
            Address addr = toAddress(region, e.getKey().getAddress());
            InitialSpec spec = e.getValue();
            d = domain.setMemoryFromConfig(addr, region, spec.getContent(), spec.getTaint(), e.getKey().getLength(), d);
        }
        return d;
    }

    private Address toAddress(Region region, BigInteger offset) {
        try {
            return new Address(region, offset, config.getAddressSize());
        } catch (IllegalArgumentException e) {
            logger.error("Illegal memory initialisation at {}", offset.toString(16));
            throw new IllegalConfigurationException("Illegal memory initialisation: " + e.getMessage(), e);
        }
    }

    /**
     * Checks that the content and taint of a register initializer fit in the register width.
     */
    static void checkInitSize(Register r, InitialSpec spec) {
        InitialContent c = spec.getContent();
        switch (c.getKind()) {
            case EXACT:
                check(c.getValue(), r);
                break;
            case MASKED:
                check(c.getValue(), r);
                check(c.getMask(), r);
                break;
            default:
                abort(r, "Illegal memory init \"|xx|\" spec used for register " + r.getName());
        }
        InitialTaint t = spec.getTaint();
        if (t != null) {
            check(t.getValue(), r);
            if (t.isMasked()) {
                check(t.getMask(), r);
            }
        }
    }

    private static void check(BigInteger b, Register r) {
        if (bitLength(b) > r.getWidth()) {
            abort(r, "Illegal initialisation for register " + r.getName());
        }
    }

    // length of the binary writing of b; zero is written "0"
    private static int bitLength(BigInteger b) {
        return Math.max(1, b.bitLength());
    }

    private static void abort(Register r, String message) {
        logger.error(message);
        throw IllegalConfigurationException.forRegister(r.getName(), message);
    }
}
