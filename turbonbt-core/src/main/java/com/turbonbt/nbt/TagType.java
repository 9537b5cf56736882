package com.turbonbt.nbt;

/**
 * The closed set of NBT tag kinds, keyed by their on-disk type id.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public enum TagType {
    END(0, "TAG_End"),
    BYTE(1, "TAG_Byte"),
    SHORT(2, "TAG_Short"),
    INT(3, "TAG_Int"),
    LONG(4, "TAG_Long"),
    FLOAT(5, "TAG_Float"),
    DOUBLE(6, "TAG_Double"),
    BYTE_ARRAY(7, "TAG_Byte_Array"),
    STRING(8, "TAG_String"),
    LIST(9, "TAG_List"),
    COMPOUND(10, "TAG_Compound"),
    INT_ARRAY(11, "TAG_Int_Array"),
    LONG_ARRAY(12, "TAG_Long_Array");

    private static final TagType[] BY_ID = values();

    private final int id;
    private final String displayName;

    TagType(int id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /**
     * Look up a tag type by its id.
     *
     * @param id Type id as read from the stream (0-255)
     * @return Matching type, or null if the id is not a known tag kind
     */
    public static TagType byId(int id) {
        if (id < 0 || id >= BY_ID.length) {
            return null;
        }
        return BY_ID[id];
    }

    public int getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether values of this type contain other tags.
     */
    public boolean isContainer() {
        return this == LIST || this == COMPOUND;
    }
}
