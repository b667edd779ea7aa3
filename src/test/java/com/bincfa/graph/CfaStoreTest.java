package com.bincfa.graph;

import com.bincfa.config.InitialContent;
import com.bincfa.domain.ConfigSnapshotDomain;
import com.bincfa.domain.SnapshotValue;
import com.bincfa.model.Address;
import com.bincfa.model.DecodingContext;
import com.bincfa.model.Region;
import com.bincfa.model.TextStatement;
import com.bincfa.report.CfaPrinter;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

public class CfaStoreTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private ConfigSnapshotDomain domain;

    @Before
    public void setUp() {
        domain = new ConfigSnapshotDomain();
    }

    /**
     * Five states numbered 1..5 in a chain, the allocator having issued 5 identifiers.
     */
    private Cfa<SnapshotValue> chain() {
        Cfa<SnapshotValue> cfa = Cfa.create(domain);
        State<SnapshotValue> root = cfa.initState(Address.global(0x401000, 32), domain.init(), new DecodingContext(32, 32));
        State<SnapshotValue> prev = null;
        for (int i = 0; i < 5; i++) {
            State<SnapshotValue> s = cfa.copyState(root);
            s.setIp(Address.global(0x401000 + 2 * (i + 1), 32));
            if (prev != null) {
                cfa.addSuccessor(prev, s);
            }
            prev = s;
        }
        cfa.removeState(root);
        return cfa;
    }

    @Test
    public void roundTripKeepsVerticesEdgesAndCounter() throws Exception {
        Cfa<SnapshotValue> cfa = chain();
        Assert.assertEquals(5, cfa.size());
        Assert.assertEquals(4, cfa.edgeCount());
        Assert.assertEquals(5, cfa.getIdAllocator().current());

        File file = tmp.newFile("cfa.bin");
        CfaStore.marshal(file.toPath(), cfa);
        Cfa<SnapshotValue> restored = CfaStore.unmarshal(file.toPath(), domain);

        Assert.assertEquals(ids(cfa), ids(restored));
        Assert.assertEquals(edges(cfa), edges(restored));
        Assert.assertEquals(5, restored.getIdAllocator().current());

        State<SnapshotValue> fresh = restored.copyState(restored.getState(5).get());
        Assert.assertEquals(6, fresh.getId());
    }

    @Test
    public void roundTripKeepsEveryField() throws Exception {
        Cfa<SnapshotValue> cfa = Cfa.create(domain);
        SnapshotValue v = domain.setMemoryFromConfig(new Address(Region.HEAP, BigInteger.valueOf(0x20), 32),
                Region.HEAP, InitialContent.exact(BigInteger.TEN), null, 2, domain.init());
        State<SnapshotValue> root = cfa.initState(Address.global(0x401000, 32), v, new DecodingContext(32, 16));
        State<SnapshotValue> s = cfa.copyState(root);
        s.setIp(new Address(Region.GLOBAL, new BigInteger("401005", 16), 32));
        s.setStmts(Arrays.asList(new TextStatement("eax <- 0x1"), new TextStatement("jmp 0x401010")));
        s.setBytes(new byte[]{(byte) 0xb8, 0x01, 0x00, 0x00, 0x00});
        s.setFinalState(true);
        s.setBackLoop(true);
        s.setForwardLoop(false);
        s.setBranch(Boolean.TRUE);
        s.setTainted(true);
        cfa.addSuccessor(root, s);

        File file = tmp.newFile("fields.bin");
        CfaStore.marshal(file.toPath(), cfa);
        Cfa<SnapshotValue> restored = CfaStore.unmarshal(file.toPath(), domain);

        State<SnapshotValue> r = restored.getState(s.getId()).get();
        Assert.assertEquals(s.getIp(), r.getIp());
        Assert.assertEquals(32, r.getIp().getWidth());
        Assert.assertEquals(v, r.getValue());
        Assert.assertEquals(new DecodingContext(32, 16), r.getContext());
        Assert.assertEquals(s.getStmts(), r.getStmts());
        Assert.assertArrayEquals(s.getBytes(), r.getBytes());
        Assert.assertTrue(r.isFinalState());
        Assert.assertTrue(r.isBackLoop());
        Assert.assertFalse(r.isForwardLoop());
        Assert.assertEquals(Boolean.TRUE, r.getBranch().get());
        Assert.assertTrue(r.isTainted());

        State<SnapshotValue> restoredRoot = restored.getState(Cfa.ROOT_ID).get();
        Assert.assertFalse(restoredRoot.getBranch().isPresent());
        Assert.assertEquals(restoredRoot, restored.requirePred(r));
    }

    @Test
    public void printedDumpsMatchAfterRestore() throws Exception {
        Cfa<SnapshotValue> cfa = chain();
        File file = tmp.newFile("dump.bin");
        CfaStore.marshal(file.toPath(), cfa);

        CfaPrinter printer = new CfaPrinter(3);
        Assert.assertEquals(printer.render(cfa), printer.render(CfaStore.unmarshal(file.toPath(), domain)));
    }

    @Test(expected = IOException.class)
    public void truncatedCheckpointIsRejected() throws Exception {
        Cfa<SnapshotValue> cfa = chain();
        File file = tmp.newFile("cut.bin");
        CfaStore.marshal(file.toPath(), cfa);
        byte[] all = Files.readAllBytes(file.toPath());
        Files.write(file.toPath(), Arrays.copyOf(all, all.length / 2));

        CfaStore.unmarshal(file.toPath(), domain);
    }

    private static Set<Long> ids(Cfa<SnapshotValue> cfa) {
        Set<Long> ids = new HashSet<>();
        cfa.iterState(s -> ids.add(s.getId()));
        return ids;
    }

    private static Set<String> edges(Cfa<SnapshotValue> cfa) {
        Set<String> edges = new HashSet<>();
        cfa.iterEdges((src, dst) -> edges.add(src.getId() + "->" + dst.getId()));
        return edges;
    }
}
