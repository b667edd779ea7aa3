package com.bincfa.graph;

import com.bincfa.model.Address;
import com.bincfa.model.DecodingContext;
import com.bincfa.model.Statement;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of a {@link State}.
 */
@Data
@NoArgsConstructor
public class StateRecord<D> {
    @JsonProperty("id")
    private long id;

    @JsonProperty("ip")
    private Address ip;

    @JsonProperty("v")
    private D value;

    @JsonProperty("ctx")
    private DecodingContext context;

    @JsonProperty("stmts")
    private List<Statement> stmts = new ArrayList<>();

    @JsonProperty("final")
    private boolean finalState;

    @JsonProperty("back_loop")
    private boolean backLoop;

    @JsonProperty("forward_loop")
    private boolean forwardLoop;

    @JsonProperty("branch")
    private Boolean branch;

    @JsonProperty("bytes")
    private byte[] bytes = new byte[0];

    @JsonProperty("is_tainted")
    private boolean tainted;

    static <D> StateRecord<D> of(State<D> s) {
        StateRecord<D> r = new StateRecord<>();
        r.id = s.getId();
        r.ip = s.getIp();
        r.value = s.getValue();
        r.context = s.getContext();
        r.stmts = new ArrayList<>(s.getStmts());
        r.finalState = s.isFinalState();
        r.backLoop = s.isBackLoop();
        r.forwardLoop = s.isForwardLoop();
        r.branch = s.getBranch().orElse(null);
        r.bytes = s.getBytes();
        r.tainted = s.isTainted();
        return r;
    }

    State<D> toState() {
        State<D> s = new State<>(id, ip, value, context);
        s.setStmts(stmts == null ? new ArrayList<>() : stmts);
        s.setFinalState(finalState);
        s.setBackLoop(backLoop);
        s.setForwardLoop(forwardLoop);
        s.setBranch(branch);
        s.setBytes(bytes);
        s.setTainted(tainted);
        return s;
    }
}
