package com.bincfa.graph;

import com.bincfa.domain.Domain;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Binary checkpoints of a CFA.
 * <p>
 * A checkpoint holds two consecutive CBOR values: the {@link CfaSnapshot} and the last identifier
 * issued by the allocator. There is no version field.
 */
public final class CfaStore {
    private static final Logger logger = LoggerFactory.getLogger(CfaStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper(new CBORFactory());

    private CfaStore() {
    }

    public static <D> void marshal(Path path, Cfa<D> cfa) throws IOException {
        CfaSnapshot<D> snapshot = new CfaSnapshot<>();
        List<State<D>> states = new ArrayList<>(cfa.getStates());
        states.sort(Comparator.naturalOrder());
        for (State<D> s : states) {
            snapshot.getStates().add(StateRecord.of(s));
        }
        cfa.iterEdges((src, dst) -> snapshot.getEdges().add(new EdgeRecord(src.getId(), dst.getId())));

        try (OutputStream out = Files.newOutputStream(path);
             JsonGenerator gen = MAPPER.getFactory().createGenerator(out)) {
            MAPPER.writeValue(gen, snapshot);
            gen.writeNumber(cfa.getIdAllocator().current());
        }
        logger.info("CFA marshalled to {}: {} states, {} edges", path, snapshot.getStates().size(), snapshot.getEdges().size());
    }

    /**
     * Restores a CFA written by {@link #marshal}. Its allocator continues from the persisted
     * identifier, so states created afterwards never collide with restored ones.
     */
    public static <D> Cfa<D> unmarshal(Path path, Domain<D> domain) throws IOException {
        JavaType type = MAPPER.getTypeFactory().constructParametricType(CfaSnapshot.class, domain.valueType());
        CfaSnapshot<D> snapshot;
        Long lastId;
        try (InputStream in = Files.newInputStream(path);
             JsonParser parser = MAPPER.getFactory().createParser(in)) {
            snapshot = MAPPER.readValue(parser, type);
            lastId = MAPPER.readValue(parser, Long.class);
        }
        if (snapshot == null || lastId == null) {
            throw new IOException("Truncated CFA checkpoint: " + path);
        }

        Cfa<D> cfa = new Cfa<>(domain, new StateIdAllocator(lastId));
        for (StateRecord<D> record : snapshot.getStates()) {
            if (cfa.getState(record.getId()).isPresent()) {
                throw new IOException("Duplicate state " + record.getId() + " in " + path);
            }
            cfa.addState(record.toState());
        }
        for (EdgeRecord e : snapshot.getEdges()) {
            State<D> src = cfa.getState(e.getSrc())
                    .orElseThrow(() -> new IOException("Edge from unknown state " + e.getSrc() + " in " + path));
            State<D> dst = cfa.getState(e.getDst())
                    .orElseThrow(() -> new IOException("Edge to unknown state " + e.getDst() + " in " + path));
            cfa.addSuccessor(src, dst);
        }
        logger.info("CFA unmarshalled from {}: {} states, {} edges, last id {}",
                path, cfa.size(), snapshot.getEdges().size(), lastId);
        return cfa;
    }
}
