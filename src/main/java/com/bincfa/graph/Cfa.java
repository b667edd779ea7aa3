package com.bincfa.graph;

import com.bincfa.domain.Domain;
import com.bincfa.model.Address;
import com.bincfa.model.DecodingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import soot.toolkits.graph.HashMutableDirectedGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Control Flow Automaton: states as vertices, "control may flow from src to dst" as edges.
 * <p>
 * States live in an arena indexed by identifier and the adjacency only holds identifiers, so
 * mutating a state never disturbs the graph structure. The CFA owns its states and its
 * identifier allocator. Not thread-safe.
 *
 * @param <D> abstract value type
 */
public class Cfa<D> {
    private static final Logger logger = LoggerFactory.getLogger(Cfa.class);

    /** identifier of the root state; cloned states are numbered from ROOT_ID + 1 */
    public static final long ROOT_ID = 0;

    private final Domain<D> domain;
    private final StateIdAllocator ids;
    private final Map<Long, State<D>> states = new HashMap<>();
    private final HashMutableDirectedGraph<Long> edges = new HashMutableDirectedGraph<>();

    Cfa(Domain<D> domain, StateIdAllocator ids) {
        this.domain = domain;
        this.ids = ids;
    }

    public static <D> Cfa<D> create(Domain<D> domain) {
        return new Cfa<>(domain, new StateIdAllocator());
    }

    public Domain<D> getDomain() {
        return domain;
    }

    public StateIdAllocator getIdAllocator() {
        return ids;
    }

    /**
     * Seeds the root state: all flags cleared, no statements nor bytes, identifier {@link #ROOT_ID}.
     * The allocator is reset so that the next copied state gets {@code ROOT_ID + 1}.
     *
     * @throws IllegalStateException if the CFA already holds states
     */
    public State<D> initState(Address ip, D value, DecodingContext context) {
        if (!states.isEmpty()) {
            throw new IllegalStateException("Cannot seed a root into a CFA holding " + states.size() + " states");
        }
        ids.reset(ROOT_ID);
        State<D> root = new State<>(ROOT_ID, ip, value, context);
        addState(root);
        return root;
    }

    /**
     * Adds a copy of {@code v} under a fresh identifier.
     */
    public State<D> copyState(State<D> v) {
        State<D> copy = v.withId(ids.next());
        addState(copy);
        logger.debug("State {} copied from {} at {}", copy.getId(), v.getId(), v.getIp());
        return copy;
    }

    /**
     * Adds {@code v} as a vertex. Adding the same state twice is a no-op.
     *
     * @throws IllegalArgumentException if another state already holds the identifier of {@code v}
     */
    public void addState(State<D> v) {
        State<D> present = states.get(v.getId());
        if (present == v) {
            return;
        }
        if (present != null) {
            throw new IllegalArgumentException("Identifier " + v.getId() + " already belongs to another state");
        }
        states.put(v.getId(), v);
        edges.addNode(v.getId());
    }

    /**
     * Removes the state and every edge touching it.
     */
    public void removeState(State<D> v) {
        if (states.remove(v.getId()) == null) {
            return;
        }
        edges.removeNode(v.getId());
        logger.debug("State {} removed", v.getId());
    }

    /**
     * @throws IllegalArgumentException if one of the endpoints is not a vertex of this CFA
     */
    public void addSuccessor(State<D> src, State<D> dst) {
        requireVertex(src);
        requireVertex(dst);
        if (!edges.containsEdge(src.getId(), dst.getId())) {
            edges.addEdge(src.getId(), dst.getId());
        }
    }

    public void removeSuccessor(State<D> src, State<D> dst) {
        if (hasSuccessor(src, dst)) {
            edges.removeEdge(src.getId(), dst.getId());
        }
    }

    public boolean contains(State<?> v) {
        return states.containsKey(v.getId());
    }

    public boolean hasSuccessor(State<D> src, State<D> dst) {
        return contains(src) && contains(dst) && edges.containsEdge(src.getId(), dst.getId());
    }

    public int size() {
        return states.size();
    }

    public Collection<State<D>> getStates() {
        return Collections.unmodifiableCollection(states.values());
    }

    /**
     * @return the vertex with the given identifier, if any
     */
    public Optional<State<D>> getState(long id) {
        return Optional.ofNullable(states.get(id));
    }

    public List<State<D>> succs(State<D> v) {
        requireVertex(v);
        return resolve(edges.getSuccsOf(v.getId()));
    }

    public List<State<D>> preds(State<D> v) {
        requireVertex(v);
        return resolve(edges.getPredsOf(v.getId()));
    }

    /**
     * Returns the predecessor of a state reached by a single incoming edge.
     *
     * @return empty when the state has no predecessor
     * @throws IllegalStateException when the state has several predecessors; use {@link #preds} at merge points
     */
    public Optional<State<D>> pred(State<D> v) {
        List<State<D>> preds = preds(v);
        if (preds.isEmpty()) {
            return Optional.empty();
        }
        if (preds.size() > 1) {
            throw new IllegalStateException("State " + v.getId() + " has " + preds.size() + " predecessors");
        }
        return Optional.of(preds.get(0));
    }

    public State<D> requirePred(State<D> v) throws NoPredecessorException {
        return pred(v).orElseThrow(() -> new NoPredecessorException(v.getId()));
    }

    /**
     * @return the states without any successor
     */
    public List<State<D>> sinks() {
        List<State<D>> sinks = new ArrayList<>();
        for (State<D> v : states.values()) {
            if (edges.getSuccsOf(v.getId()).isEmpty()) {
                sinks.add(v);
            }
        }
        return sinks;
    }

    /**
     * Among the states whose instruction pointer is {@code ip}, returns the most recently created one.
     */
    public Optional<State<D>> lastAddr(Address ip) {
        State<D> last = null;
        for (State<D> v : states.values()) {
            if (ip.equals(v.getIp()) && (last == null || last.getId() < v.getId())) {
                last = v;
            }
        }
        return Optional.ofNullable(last);
    }

    public State<D> requireLastAddr(Address ip) throws StateNotFoundException {
        return lastAddr(ip).orElseThrow(() -> new StateNotFoundException(ip));
    }

    public void iterState(Consumer<? super State<D>> f) {
        // copy so that f may mutate the graph
        for (State<D> v : new ArrayList<>(states.values())) {
            f.accept(v);
        }
    }

    public void iterEdges(BiConsumer<? super State<D>, ? super State<D>> f) {
        for (Long src : new ArrayList<>(states.keySet())) {
            if (!states.containsKey(src)) continue; // removed by f
            for (Long dst : new ArrayList<>(edges.getSuccsOf(src))) {
                if (states.containsKey(src) && states.containsKey(dst)) {
                    f.accept(states.get(src), states.get(dst));
                }
            }
        }
    }

    public int edgeCount() {
        int n = 0;
        for (Long src : states.keySet()) {
            n += edges.getSuccsOf(src).size();
        }
        return n;
    }

    private void requireVertex(State<D> v) {
        if (!contains(v)) {
            logger.debug("State {} used before being added", v.getId());
            throw new IllegalArgumentException("State " + v.getId() + " is not a vertex of this CFA");
        }
    }

    private List<State<D>> resolve(List<Long> idList) {
        List<State<D>> result = new ArrayList<>(idList.size());
        for (Long id : idList) {
            result.add(states.get(id));
        }
        return result;
    }
}
