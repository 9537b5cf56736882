package com.turbonbt.nbt;

import com.turbonbt.nbt.snbt.SnbtWriter;

/**
 * Base class of every NBT value.
 * <p>
 * The constructor is package-private, so the hierarchy is closed to the final
 * tag classes of this package and a switch over {@link #getType()} covers every kind.
 * Names are not part of a tag; they live on {@link CompoundTag} entries and on
 * {@link NamedTag} for the root.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public abstract class Tag {

    Tag() {
    }

    /**
     * Get the kind of this tag.
     */
    public abstract TagType getType();

    /**
     * Create a deep copy of this tag.
     */
    public abstract Tag copy();

    @Override
    public String toString() {
        return SnbtWriter.toSnbt(this);
    }
}
