package com.bincfa.analysis;

import com.bincfa.config.ContentSpecParser;
import com.bincfa.config.IllegalConfigurationException;
import com.bincfa.config.InitialConfiguration;
import com.bincfa.config.InitialContent;
import com.bincfa.config.InitialTaint;
import com.bincfa.config.MemoryKey;
import com.bincfa.domain.ConfigSnapshotDomain;
import com.bincfa.domain.Domain;
import com.bincfa.domain.SnapshotValue;
import com.bincfa.graph.Cfa;
import com.bincfa.graph.State;
import com.bincfa.model.Address;
import com.bincfa.model.Region;
import com.bincfa.model.Register;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class CfaInitializerTest {
    private Register al;
    private Register esp;
    private InitialConfiguration config;

    @Before
    public void setUp() {
        al = new Register("al", 8);
        esp = new Register("esp", 32, true);
        config = new InitialConfiguration();
        config.getRegisters().addAll(Arrays.asList(al, esp));
        config.setEntrypoint(Address.global(0x401000, 32));
    }

    @Test
    public void valueFittingTheRegisterIsAccepted() {
        config.addRegisterContent(al, ContentSpecParser.parse("0xFF", "register al"));

        SnapshotValue v = new CfaInitializer<>(new ConfigSnapshotDomain(), config).initAbstractValue();

        Assert.assertEquals("0xff", v.getRegisters().get("al"));
    }

    @Test
    public void oversizedValueAbortsNamingTheRegister() {
        config.addRegisterContent(al, ContentSpecParser.parse("0x1FF", "register al"));

        try {
            new CfaInitializer<>(new ConfigSnapshotDomain(), config).initAbstractValue();
            Assert.fail("expected IllegalConfigurationException");
        } catch (IllegalConfigurationException e) {
            Assert.assertEquals("al", e.getRegisterName());
            Assert.assertTrue(e.getMessage().contains("al"));
        }
    }

    @Test(expected = IllegalConfigurationException.class)
    public void oversizedMaskAborts() {
        config.addRegisterContent(al, ContentSpecParser.parse("0x1?0x100", "register al"));
        new CfaInitializer<>(new ConfigSnapshotDomain(), config).initAbstractValue();
    }

    @Test(expected = IllegalConfigurationException.class)
    public void oversizedTaintAborts() {
        config.addRegisterContent(al, ContentSpecParser.parse("0x1!0x100", "register al"));
        new CfaInitializer<>(new ConfigSnapshotDomain(), config).initAbstractValue();
    }

    @Test
    public void bytePatternForRegisterAborts() {
        config.addRegisterContent(esp, ContentSpecParser.parse("|0010|", "register esp"));
        try {
            new CfaInitializer<>(new ConfigSnapshotDomain(), config).initAbstractValue();
            Assert.fail("expected IllegalConfigurationException");
        } catch (IllegalConfigurationException e) {
            Assert.assertEquals("esp", e.getRegisterName());
        }
    }

    @Test
    public void zeroFitsOneBitRegister() {
        Register zf = new Register("zf", 1);
        config.getRegisters().add(zf);
        config.addRegisterContent(zf, ContentSpecParser.parse("0x0!0x1", "register zf"));

        SnapshotValue v = new CfaInitializer<>(new ConfigSnapshotDomain(), config).initAbstractValue();

        Assert.assertEquals("0x0!0x1", v.getRegisters().get("zf"));
    }

    @Test
    public void stackPointerGoesToStackRegion() {
        config.addRegisterContent(esp, ContentSpecParser.parse("0x1000", "register esp"));
        config.addRegisterContent(al, ContentSpecParser.parse("0x1", "register al"));
        RecordingDomain domain = new RecordingDomain();

        new CfaInitializer<>(domain, config).initAbstractValue();

        Assert.assertTrue(domain.calls.contains("set_register esp STACK 0x1000"));
        Assert.assertTrue(domain.calls.contains("set_register al GLOBAL 0x1"));
    }

    @Test
    public void stepsRunInOrder() {
        config.addRegisterContent(al, ContentSpecParser.parse("0x1", "register al"));
        config.addMemoryContent(Region.HEAP, new MemoryKey(BigInteger.valueOf(0x30), 1), ContentSpecParser.parse("0x3", "heap"));
        config.addMemoryContent(Region.STACK, new MemoryKey(BigInteger.valueOf(0x20), 1), ContentSpecParser.parse("0x2", "stack"));
        config.addMemoryContent(Region.GLOBAL, new MemoryKey(BigInteger.valueOf(0x10), 4), ContentSpecParser.parse("|00ff|!0xff", "global"));
        RecordingDomain domain = new RecordingDomain();

        new CfaInitializer<>(domain, config).initAbstractValue();

        Assert.assertEquals(Arrays.asList(
                "init",
                "add_register al",
                "add_register esp",
                "set_register al GLOBAL 0x1",
                "set_memory 0x10 GLOBAL |00ff|!0xff *4",
                "set_memory stack:0x20 STACK 0x2 *1",
                "set_memory heap:0x30 HEAP 0x3 *1"), domain.calls);
    }

    @Test
    public void registerOrderDoesNotDependOnInsertionOrder() {
        Register bl = new Register("bl", 8);
        config.getRegisters().add(bl);

        InitialConfiguration other = new InitialConfiguration();
        other.getRegisters().addAll(config.getRegisters());

        config.addRegisterContent(bl, ContentSpecParser.parse("0x2", "bl"));
        config.addRegisterContent(al, ContentSpecParser.parse("0x1", "al"));
        other.addRegisterContent(al, ContentSpecParser.parse("0x1", "al"));
        other.addRegisterContent(bl, ContentSpecParser.parse("0x2", "bl"));

        RecordingDomain d1 = new RecordingDomain();
        RecordingDomain d2 = new RecordingDomain();
        new CfaInitializer<>(d1, config).initAbstractValue();
        new CfaInitializer<>(d2, other).initAbstractValue();

        Assert.assertEquals(d1.calls, d2.calls);
    }

    @Test
    public void memoryAddressMustFitAddressSize() {
        config.setAddressSize(16);
        config.addMemoryContent(Region.GLOBAL, new MemoryKey(BigInteger.valueOf(0x10000), 1), ContentSpecParser.parse("0x1", "global"));

        try {
            new CfaInitializer<>(new ConfigSnapshotDomain(), config).initAbstractValue();
            Assert.fail("expected IllegalConfigurationException");
        } catch (IllegalConfigurationException e) {
            Assert.assertNull(e.getRegisterName());
        }
    }

    @Test
    public void initStateSeedsRootAtEntrypoint() {
        config.setOperandSize(16);
        config.addRegisterContent(esp, ContentSpecParser.parse("0x1000", "register esp"));
        Cfa<SnapshotValue> cfa = Cfa.create(new ConfigSnapshotDomain());

        State<SnapshotValue> root = new CfaInitializer<>(cfa.getDomain(), config).initState(cfa);

        Assert.assertEquals(Cfa.ROOT_ID, root.getId());
        Assert.assertEquals(Address.global(0x401000, 32), root.getIp());
        Assert.assertEquals(16, root.getContext().getOperandSize());
        Assert.assertEquals(32, root.getContext().getAddressSize());
        Assert.assertEquals("stack:0x1000", root.getValue().getRegisters().get("esp"));
        Assert.assertEquals("?", root.getValue().getRegisters().get("al"));
        Assert.assertEquals(Collections.singletonList(root), new ArrayList<>(cfa.getStates()));
    }

    @Test(expected = IllegalConfigurationException.class)
    public void initStateRequiresEntrypoint() {
        config.setEntrypoint(null);
        Cfa<SnapshotValue> cfa = Cfa.create(new ConfigSnapshotDomain());
        new CfaInitializer<>(cfa.getDomain(), config).initState(cfa);
    }

    /**
     * Domain whose value is the list of calls received.
     */
    static class RecordingDomain implements Domain<RecordingDomain.Calls> {
        final List<String> calls = new ArrayList<>();

        static class Calls {
        }

        @Override
        public Calls init() {
            calls.add("init");
            return new Calls();
        }

        @Override
        public Calls addRegister(Register register, Calls value) {
            calls.add("add_register " + register.getName());
            return value;
        }

        @Override
        public Calls setRegisterFromConfig(Register register, Region region, InitialContent content,
                                           InitialTaint taint, Calls value) {
            calls.add("set_register " + register.getName() + " " + region + " " + content + (taint == null ? "" : "!" + taint));
            return value;
        }

        @Override
        public Calls setMemoryFromConfig(Address address, Region region, InitialContent content,
                                         InitialTaint taint, int length, Calls value) {
            calls.add("set_memory " + address + " " + region + " " + content + (taint == null ? "" : "!" + taint) + " *" + length);
            return value;
        }

        @Override
        public List<String> toLines(Calls value) {
            return calls;
        }

        @Override
        public Class<Calls> valueType() {
            return Calls.class;
        }
    }
}
