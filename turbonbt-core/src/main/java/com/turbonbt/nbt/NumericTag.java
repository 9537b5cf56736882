package com.turbonbt.nbt;

/**
 * Common supertype of the six fixed-width number tags.
 */
public abstract class NumericTag extends Tag {

    NumericTag() {
    }

    public abstract Number getAsNumber();

    public long getAsLong() {
        return getAsNumber().longValue();
    }

    public int getAsInt() {
        return getAsNumber().intValue();
    }

    public double getAsDouble() {
        return getAsNumber().doubleValue();
    }
}
