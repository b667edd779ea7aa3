package com.bincfa.domain;

import com.bincfa.config.InitialContent;
import com.bincfa.config.InitialTaint;
import com.bincfa.model.Address;
import com.bincfa.model.Region;
import com.bincfa.model.Register;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reference domain without lattice operations. It records what the configuration says about
 * each register and memory location, so a seeded CFA can be checkpointed and inspected without
 * a real abstract domain.
 */
public class ConfigSnapshotDomain implements Domain<SnapshotValue> {
    static final String UNKNOWN = "?";

    @Override
    public SnapshotValue init() {
        return new SnapshotValue();
    }

    @Override
    public SnapshotValue addRegister(Register register, SnapshotValue value) {
        SnapshotValue v = value.copy();
        v.getRegisters().putIfAbsent(register.getName(), UNKNOWN);
        return v;
    }

    @Override
    public SnapshotValue setRegisterFromConfig(Register register, Region region, InitialContent content,
                                               InitialTaint taint, SnapshotValue value) {
        SnapshotValue v = value.copy();
        String text = region == Region.GLOBAL ? content.toString() : region.prefix() + content;
        v.getRegisters().put(register.getName(), withTaint(text, taint));
        return v;
    }

    @Override
    public SnapshotValue setMemoryFromConfig(Address address, Region region, InitialContent content,
                                             InitialTaint taint, int length, SnapshotValue value) {
        SnapshotValue v = value.copy();
        int digits = Math.max(1, (address.getWidth() + 3) / 4);
        String key = region.prefix() + String.format("0x%0" + digits + "x", address.getOffset()) + "*" + length;
        v.getMemory().put(key, withTaint(content.toString(), taint));
        return v;
    }

    private static String withTaint(String content, InitialTaint taint) {
        return taint == null ? content : content + "!" + taint;
    }

    @Override
    public List<String> toLines(SnapshotValue value) {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, String> e : value.getRegisters().entrySet()) {
            lines.add("reg [" + e.getKey() + "] = " + e.getValue());
        }
        for (Map.Entry<String, String> e : value.getMemory().entrySet()) {
            lines.add("mem [" + e.getKey() + "] = " + e.getValue());
        }
        return lines;
    }

    @Override
    public Class<SnapshotValue> valueType() {
        return SnapshotValue.class;
    }
}
