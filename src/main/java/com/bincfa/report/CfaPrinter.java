package com.bincfa.report;

import com.bincfa.graph.Cfa;
import com.bincfa.graph.State;
import com.bincfa.model.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Human readable dump of a CFA. Not meant to be read back.
 * <pre>
 * [node = 1]
 * address = 0x401000
 * bytes = 55 89 e5
 * final =false
 * tainted=false
 * reg [eax] = 0x0
 *
 * [edges]
 * e0_1 = 0 -> 1
 * </pre>
 * Decoded statements are listed when the verbosity is above 2.
 */
public class CfaPrinter {
    private static final Logger logger = LoggerFactory.getLogger(CfaPrinter.class);

    private final int verbosity;

    public CfaPrinter(int verbosity) {
        this.verbosity = verbosity;
    }

    public <D> void print(Path dumpFile, Cfa<D> cfa) throws IOException {
        try (Writer w = Files.newBufferedWriter(dumpFile, StandardCharsets.UTF_8);
             PrintWriter out = new PrintWriter(w)) {
            write(out, cfa);
        }
        logger.info("CFA dump written to: {}", dumpFile.toAbsolutePath());
    }

    public <D> String render(Cfa<D> cfa) {
        StringWriter sw = new StringWriter();
        try (PrintWriter out = new PrintWriter(sw)) {
            write(out, cfa);
        }
        return sw.toString();
    }

    <D> void write(PrintWriter out, Cfa<D> cfa) {
        // ascending ids so that dumps of the same CFA are identical
        List<State<D>> states = new ArrayList<>(cfa.getStates());
        states.sort(null);
        for (State<D> s : states) {
            printState(out, cfa, s);
        }

        out.print("[edges]\n");
        for (State<D> src : states) {
            List<State<D>> succs = cfa.succs(src);
            succs.sort(null);
            for (State<D> dst : succs) {
                out.printf("e%d_%d = %d -> %d\n", src.getId(), dst.getId(), src.getId(), dst.getId());
            }
        }
    }

    private <D> void printState(PrintWriter out, Cfa<D> cfa, State<D> s) {
        StringBuilder bytes = new StringBuilder();
        for (byte b : s.getBytes()) {
            bytes.append(' ').append(String.format("%02x", b & 0xff));
        }
        out.printf("[node = %d]\naddress = %s\nbytes =%s\nfinal =%s\ntainted=%s\n",
                s.getId(), s.getIp(), bytes, s.isFinalState(), s.isTainted());
        for (String line : cfa.getDomain().toLines(s.getValue())) {
            out.print(line + "\n");
        }
        if (verbosity > 2) {
            out.print("statements =");
            for (Statement stmt : s.getStmts()) {
                out.print(" " + stmt.render(true) + "\n");
            }
        }
        out.print("\n");
    }
}
