package com.bincfa.graph;

import com.bincfa.model.Address;
import com.bincfa.model.DecodingContext;
import com.bincfa.model.Statement;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node of the CFA.
 * <p>
 * Identity, equality, hashing and ordering depend on {@link #getId()} only, so the content
 * of a state can be mutated in place while it sits in the graph. New states are obtained from
 * {@link Cfa#initState} or {@link Cfa#copyState}.
 *
 * @param <D> abstract value type
 */
@Getter
@Setter
public final class State<D> implements Comparable<State<?>> {
    @Setter(AccessLevel.NONE)
    private final long id;

    private Address ip;
    private D value;
    private DecodingContext context;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private List<Statement> stmts = new ArrayList<>();

    /** true whenever a widening operator has been applied to the value */
    private boolean finalState;
    /** true whenever the state belongs to a loop that is backward analysed */
    private boolean backLoop;
    /** true whenever the state belongs to a loop that is forward analysed */
    private boolean forwardLoop;

    // null: unconditional predecessor; otherwise the branch taken from the predecessor
    @Getter(AccessLevel.NONE)
    private Boolean branch;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private byte[] bytes = new byte[0];

    /** true whenever a left value written by the statements may be tainted */
    private boolean tainted;

    State(long id, Address ip, D value, DecodingContext context) {
        this.id = id;
        this.ip = ip;
        this.value = value;
        this.context = context;
    }

    /**
     * @return a copy of every field under a new identifier
     */
    State<D> withId(long newId) {
        State<D> s = new State<>(newId, ip, value, context);
        s.stmts = new ArrayList<>(stmts);
        s.finalState = finalState;
        s.backLoop = backLoop;
        s.forwardLoop = forwardLoop;
        s.branch = branch;
        s.bytes = bytes.clone();
        s.tainted = tainted;
        return s;
    }

    public List<Statement> getStmts() {
        return Collections.unmodifiableList(stmts);
    }

    public void setStmts(List<? extends Statement> stmts) {
        this.stmts = new ArrayList<>(stmts);
    }

    public Optional<Boolean> getBranch() {
        return Optional.ofNullable(branch);
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public void setBytes(byte[] bytes) {
        this.bytes = bytes == null ? new byte[0] : bytes.clone();
    }

    @Override
    public int compareTo(State<?> other) {
        return Long.compare(id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof State)) return false;
        return id == ((State<?>) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "State{" + id + " @ " + ip + "}";
    }
}
