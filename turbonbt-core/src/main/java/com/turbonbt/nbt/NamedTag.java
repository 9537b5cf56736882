package com.turbonbt.nbt;

import java.util.Objects;

/**
 * A root tag together with its name, as stored at the top of an NBT file.
 *
 * @param name Root name, usually empty
 * @param tag  Root value, usually a {@link CompoundTag}
 */
public record NamedTag(String name, Tag tag) {

    public NamedTag {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tag, "tag");
    }

    public static NamedTag unnamed(Tag tag) {
        return new NamedTag("", tag);
    }

    /**
     * Get the root as a compound.
     *
     * @throws ClassCastException if the root is of another kind
     */
    public CompoundTag compound() {
        return (CompoundTag) tag;
    }
}
