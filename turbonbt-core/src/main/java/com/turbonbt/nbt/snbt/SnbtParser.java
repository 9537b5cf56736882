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
import com.turbonbt.nbt.NBTReader;
import com.turbonbt.nbt.ShortTag;
import com.turbonbt.nbt.StringTag;
import com.turbonbt.nbt.Tag;
import com.turbonbt.nbt.TagType;
import com.turbonbt.nbt.TagTypeMismatchException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for SNBT text.
 * <p>
 * Accepts what {@link SnbtWriter} produces plus single-quoted strings, whitespace between
 * tokens, {@code true}/{@code false} (bytes 1 and 0) and unsuffixed decimals (doubles).
 * Bare words are not read as strings. Nesting is limited to
 * {@link NBTReader#DEFAULT_MAX_DEPTH} levels, the same limit binary reads use.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public final class SnbtParser {

    private static final Pattern INTEGER = Pattern.compile("([+-]?(?:0|[1-9][0-9]*))([bBsSlL]?)");
    private static final Pattern SUFFIXED_DECIMAL =
            Pattern.compile("([+-]?(?:[0-9]+\\.?|[0-9]*\\.[0-9]+)(?:[eE][+-]?[0-9]+)?)([fFdD])");
    private static final Pattern PLAIN_DECIMAL =
            Pattern.compile("[+-]?(?:(?:[0-9]+\\.[0-9]*|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?|[0-9]+[eE][+-]?[0-9]+)");

    private final String input;
    private int pos;
    private int depth;

    private SnbtParser(String input) {
        this.input = input;
        this.pos = 0;
        this.depth = 0;
    }

    /**
     * Parse a complete SNBT document.
     *
     * @param text SNBT text; surrounding whitespace is ignored
     * @return Parsed tag
     * @throws SnbtParseException if the text is malformed or has trailing content
     */
    public static Tag parse(String text) throws SnbtParseException {
        SnbtParser parser = new SnbtParser(text);
        Tag tag = parser.readValue();
        parser.skipWhitespace();
        if (parser.pos < text.length()) {
            throw new SnbtParseException("Unexpected trailing content", parser.pos);
        }
        return tag;
    }

    private Tag readValue() throws SnbtParseException {
        skipWhitespace();
        if (pos >= input.length()) {
            throw new SnbtParseException("Expected a value", pos);
        }
        char c = input.charAt(pos);
        if (c == '"' || c == '\'') {
            return new StringTag(readQuoted());
        }
        if (c == '{') {
            return readCompound();
        }
        if (c == '[') {
            if (pos + 2 < input.length() && input.charAt(pos + 2) == ';'
                    && "BIL".indexOf(input.charAt(pos + 1)) >= 0) {
                return readArray();
            }
            return readList();
        }
        return readScalar();
    }

    private CompoundTag readCompound() throws SnbtParseException {
        enter();
        pos++; // {
        CompoundTag compound = new CompoundTag();
        skipWhitespace();
        if (consume('}')) {
            depth--;
            return compound;
        }
        while (true) {
            skipWhitespace();
            String key;
            if (pos < input.length() && (input.charAt(pos) == '"' || input.charAt(pos) == '\'')) {
                key = readQuoted();
            } else {
                key = readUnquoted();
                if (key.isEmpty()) {
                    throw new SnbtParseException("Expected a compound key", pos);
                }
            }
            skipWhitespace();
            expect(':');
            compound.put(key, readValue());
            skipWhitespace();
            if (consume('}')) {
                break;
            }
            expect(',');
        }
        depth--;
        return compound;
    }

    private ListTag readList() throws SnbtParseException {
        enter();
        int start = pos;
        pos++; // [
        List<Tag> elements = new ArrayList<>();
        skipWhitespace();
        if (!consume(']')) {
            while (true) {
                elements.add(readValue());
                skipWhitespace();
                if (consume(']')) {
                    break;
                }
                expect(',');
            }
        }
        depth--;
        if (elements.isEmpty()) {
            return ListTag.empty();
        }
        try {
            return new ListTag(elements.get(0).getType(), elements);
        } catch (TagTypeMismatchException e) {
            throw new SnbtParseException("List elements must all be of one type: " + e.getMessage(), start, e);
        }
    }

    private Tag readArray() throws SnbtParseException {
        char kind = input.charAt(pos + 1);
        pos += 3; // [X;
        char expectedSuffix = kind == 'B' ? 'b' : kind == 'L' ? 'l' : 0;
        List<Long> values = new ArrayList<>();
        skipWhitespace();
        if (!consume(']')) {
            while (true) {
                skipWhitespace();
                int start = pos;
                Matcher m = INTEGER.matcher(readUnquoted());
                if (!m.matches()) {
                    throw new SnbtParseException("Expected an integer in " + kind + " array", start);
                }
                String suffix = m.group(2).toLowerCase(Locale.ROOT);
                char actualSuffix = suffix.isEmpty() ? 0 : suffix.charAt(0);
                if (actualSuffix != expectedSuffix) {
                    throw new SnbtParseException("Wrong integer kind in " + kind + " array", start);
                }
                values.add(parseLong(m.group(1), start, kind == 'B' ? Byte.MIN_VALUE : kind == 'I' ? Integer.MIN_VALUE : Long.MIN_VALUE,
                        kind == 'B' ? Byte.MAX_VALUE : kind == 'I' ? Integer.MAX_VALUE : Long.MAX_VALUE));
                skipWhitespace();
                if (consume(']')) {
                    break;
                }
                expect(',');
            }
        }

        switch (kind) {
            case 'B': {
                byte[] bytes = new byte[values.size()];
                for (int i = 0; i < bytes.length; i++) bytes[i] = values.get(i).byteValue();
                return new ByteArrayTag(bytes);
            }
            case 'I': {
                int[] ints = new int[values.size()];
                for (int i = 0; i < ints.length; i++) ints[i] = values.get(i).intValue();
                return new IntArrayTag(ints);
            }
            default: {
                long[] longs = new long[values.size()];
                for (int i = 0; i < longs.length; i++) longs[i] = values.get(i);
                return new LongArrayTag(longs);
            }
        }
    }

    private Tag readScalar() throws SnbtParseException {
        int start = pos;
        String token = readUnquoted();
        if (token.isEmpty()) {
            throw new SnbtParseException("Unexpected character '" + input.charAt(pos) + "'", pos);
        }

        Matcher m = SUFFIXED_DECIMAL.matcher(token);
        if (m.matches()) {
            if (Character.toLowerCase(m.group(2).charAt(0)) == 'f') {
                return new FloatTag(Float.parseFloat(m.group(1)));
            }
            return new DoubleTag(Double.parseDouble(m.group(1)));
        }
        if (PLAIN_DECIMAL.matcher(token).matches()) {
            return new DoubleTag(Double.parseDouble(token));
        }

        m = INTEGER.matcher(token);
        if (m.matches()) {
            String digits = m.group(1);
            switch (m.group(2).toLowerCase(Locale.ROOT)) {
                case "b":
                    return new ByteTag((byte) parseLong(digits, start, Byte.MIN_VALUE, Byte.MAX_VALUE));
                case "s":
                    return new ShortTag((short) parseLong(digits, start, Short.MIN_VALUE, Short.MAX_VALUE));
                case "l":
                    return new LongTag(parseLong(digits, start, Long.MIN_VALUE, Long.MAX_VALUE));
                default:
                    return new IntTag((int) parseLong(digits, start, Integer.MIN_VALUE, Integer.MAX_VALUE));
            }
        }

        if (token.equals("true")) {
            return ByteTag.of(true);
        }
        if (token.equals("false")) {
            return ByteTag.of(false);
        }
        throw new SnbtParseException("Cannot parse value '" + token + "'", start);
    }

    private long parseLong(String digits, int start, long min, long max) throws SnbtParseException {
        long value;
        try {
            value = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new SnbtParseException("Integer out of range: " + digits, start, e);
        }
        if (value < min || value > max) {
            throw new SnbtParseException("Integer out of range: " + digits, start);
        }
        return value;
    }

    private String readQuoted() throws SnbtParseException {
        int start = pos;
        char quote = input.charAt(pos++);
        StringBuilder value = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote) {
                return value.toString();
            }
            if (c == '\\') {
                if (pos >= input.length()) {
                    break;
                }
                char escaped = input.charAt(pos++);
                if (escaped != '\\' && escaped != '"' && escaped != '\'') {
                    throw new SnbtParseException("Invalid escape '\\" + escaped + "'", pos - 2);
                }
                value.append(escaped);
            } else {
                value.append(c);
            }
        }
        throw new SnbtParseException("Unclosed string", start);
    }

    private String readUnquoted() {
        int start = pos;
        while (pos < input.length() && isUnquotedChar(input.charAt(pos))) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private static boolean isUnquotedChar(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                || c == '.' || c == '+' || c == '_' || c == '-';
    }

    private void enter() throws SnbtParseException {
        if (++depth > NBTReader.DEFAULT_MAX_DEPTH) {
            throw new SnbtParseException("Nesting deeper than " + NBTReader.DEFAULT_MAX_DEPTH, pos);
        }
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private boolean consume(char c) {
        if (pos < input.length() && input.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char c) throws SnbtParseException {
        if (!consume(c)) {
            if (pos >= input.length()) {
                throw new SnbtParseException("Expected '" + c + "' but reached end of input", pos);
            }
            throw new SnbtParseException("Expected '" + c + "' but found '" + input.charAt(pos) + "'", pos);
        }
    }
}
