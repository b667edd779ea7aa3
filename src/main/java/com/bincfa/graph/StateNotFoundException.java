package com.bincfa.graph;

import com.bincfa.model.Address;

public class StateNotFoundException extends CfaQueryException {
    private final Address address;

    public StateNotFoundException(Address address) {
        super("no state at address " + address);
        this.address = address;
    }

    public Address getAddress() {
        return address;
    }
}
