package com.bincfa.domain;

import com.bincfa.config.InitialContent;
import com.bincfa.config.InitialTaint;
import com.bincfa.model.Address;
import com.bincfa.model.Region;
import com.bincfa.model.Register;

import java.util.List;

/**
 * Capabilities the CFA core needs from an abstract domain.
 * <p>
 * Values of type {@code D} are treated as immutable by the core: every update returns the
 * new value. Updates of distinct locations must commute, since the initializer does not
 * promise any particular order beyond being deterministic.
 *
 * @param <D> the abstract value type; must be serializable with Jackson for checkpoints
 */
public interface Domain<D> {

    /** @return the empty abstract value */
    D init();

    D addRegister(Register register, D value);

    /**
     * @param taint null when the configuration asserts no taint
     */
    D setRegisterFromConfig(Register register, Region region, InitialContent content, InitialTaint taint, D value);

    /**
     * @param length number of repetitions of {@code content} starting at {@code address}
     * @param taint  null when the configuration asserts no taint
     */
    D setMemoryFromConfig(Address address, Region region, InitialContent content, InitialTaint taint, int length, D value);

    /** @return the textual rendering of the value, one entry per line */
    List<String> toLines(D value);

    Class<D> valueType();
}
