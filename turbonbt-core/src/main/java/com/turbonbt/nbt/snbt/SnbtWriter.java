package com.turbonbt.nbt.snbt;

import com.turbonbt.nbt.ByteArrayTag;
import com.turbonbt.nbt.ByteTag;
import com.turbonbt.nbt.CompoundTag;
import com.turbonbt.nbt.DoubleTag;
import com.turbonbt.nbt.FloatTag;
import com.turbonbt.nbt.IntArrayTag;
import com.turbonbt.nbt.IntTag;
import com.turbonbt.nbt.ListTag;
import com.turbonbt.nbt.LongArrayTag;
import com.turbonbt.nbt.LongTag;
import com.turbonbt.nbt.ShortTag;
import com.turbonbt.nbt.StringTag;
import com.turbonbt.nbt.Tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders tags as SNBT (stringified NBT), the compact text form also accepted by {@link SnbtParser}.
 * <p>
 * Output has no whitespace. Every number carries its kind suffix except int, strings are
 * always double-quoted, and compound keys are quoted only when they contain characters
 * outside {@code [0-9a-zA-Z.+_-]}.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public final class SnbtWriter {

    static final Pattern UNQUOTED = Pattern.compile("[0-9a-zA-Z.+_-]+");

    private SnbtWriter() {
    }

    public static String toSnbt(Tag tag) {
        return toSnbt(tag, false);
    }

    /**
     * Render a tag.
     *
     * @param tag Tag to render
     * @param sortKeys Write compound entries in key order instead of insertion order
     * @return SNBT text
     */
    public static String toSnbt(Tag tag, boolean sortKeys) {
        StringBuilder out = new StringBuilder();
        write(out, tag, sortKeys);
        return out.toString();
    }

    private static void write(StringBuilder out, Tag tag, boolean sortKeys) {
        switch (tag.getType()) {
            case BYTE -> out.append(((ByteTag) tag).getValue()).append('b');
            case SHORT -> out.append(((ShortTag) tag).getValue()).append('s');
            case INT -> out.append(((IntTag) tag).getValue());
            case LONG -> out.append(((LongTag) tag).getValue()).append('l');
            case FLOAT -> out.append(((FloatTag) tag).getValue()).append('f');
            case DOUBLE -> out.append(((DoubleTag) tag).getValue()).append('d');
            case STRING -> quote(out, ((StringTag) tag).getValue());
            case BYTE_ARRAY -> {
                out.append("[B;");
                byte[] values = ((ByteArrayTag) tag).getValue();
                for (int i = 0; i < values.length; i++) {
                    if (i > 0) out.append(',');
                    out.append(values[i]).append('b');
                }
                out.append(']');
            }
            case INT_ARRAY -> {
                out.append("[I;");
                int[] values = ((IntArrayTag) tag).getValue();
                for (int i = 0; i < values.length; i++) {
                    if (i > 0) out.append(',');
                    out.append(values[i]);
                }
                out.append(']');
            }
            case LONG_ARRAY -> {
                out.append("[L;");
                long[] values = ((LongArrayTag) tag).getValue();
                for (int i = 0; i < values.length; i++) {
                    if (i > 0) out.append(',');
                    out.append(values[i]).append('l');
                }
                out.append(']');
            }
            case LIST -> {
                out.append('[');
                boolean first = true;
                for (Tag element : (ListTag) tag) {
                    if (!first) out.append(',');
                    write(out, element, sortKeys);
                    first = false;
                }
                out.append(']');
            }
            case COMPOUND -> {
                CompoundTag compound = (CompoundTag) tag;
                List<String> keys = new ArrayList<>(compound.keySet());
                if (sortKeys) {
                    Collections.sort(keys);
                }
                out.append('{');
                for (int i = 0; i < keys.size(); i++) {
                    if (i > 0) out.append(',');
                    String key = keys.get(i);
                    if (UNQUOTED.matcher(key).matches()) {
                        out.append(key);
                    } else {
                        quote(out, key);
                    }
                    out.append(':');
                    write(out, compound.get(key), sortKeys);
                }
                out.append('}');
            }
            default -> throw new IllegalArgumentException("Cannot render tag of type " + tag.getType());
        }
    }

    private static void quote(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        out.append('"');
    }
}
