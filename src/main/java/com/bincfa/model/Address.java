package com.bincfa.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An address in one of the memory regions.
 * Equality and ordering use the region and the offset; the width is carried along for rendering.
 */
@Getter
public final class Address implements Comparable<Address> {
    private final Region region;
    private final BigInteger offset;
    private final int width; // in bits

    @JsonCreator
    public Address(@JsonProperty("region") Region region,
                   @JsonProperty("offset") BigInteger offset,
                   @JsonProperty("width") int width) {
        if (offset.signum() < 0) {
            throw new IllegalArgumentException("Negative address offset: " + offset);
        }
        if (offset.bitLength() > width) {
            throw new IllegalArgumentException("Address " + offset.toString(16) + " does not fit in " + width + " bits");
        }
        this.region = Objects.requireNonNull(region, "region");
        this.offset = offset;
        this.width = width;
    }

    public static Address global(long offset, int width) {
        return new Address(Region.GLOBAL, BigInteger.valueOf(offset), width);
    }

    public static Address of(Region region, BigInteger offset, int width) {
        return new Address(region, offset, width);
    }

    @Override
    public int compareTo(Address other) {
        int c = region.compareTo(other.region);
        return c != 0 ? c : offset.compareTo(other.offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Address that = (Address) o;
        return region == that.region && offset.equals(that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, offset);
    }

    @Override
    public String toString() {
        return region.prefix() + "0x" + offset.toString(16);
    }
}
