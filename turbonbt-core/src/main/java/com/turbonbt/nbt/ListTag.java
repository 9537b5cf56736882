package com.turbonbt.nbt;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, homogeneous sequence of unnamed tags.
 * <p>
 * The element type is fixed when the list is created and every insertion is checked
 * against it. A list of {@link TagType#END} can never hold elements; it is how the
 * format encodes a list whose element type was never decided.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public final class ListTag extends Tag implements Iterable<Tag> {

    private final TagType elementType;
    private final List<Tag> elements;

    public ListTag(TagType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.elements = new ArrayList<>();
    }

    /**
     * Create a list holding the given elements.
     *
     * @throws TagTypeMismatchException if any element is not of {@code elementType}
     */
    public ListTag(TagType elementType, Collection<? extends Tag> elements) {
        this(elementType);
        for (Tag element : elements) {
            add(element);
        }
    }

    public static ListTag of(TagType elementType, Tag... elements) {
        return new ListTag(elementType, List.of(elements));
    }

    /**
     * Empty list with undecided element type.
     */
    public static ListTag empty() {
        return new ListTag(TagType.END);
    }

    private Tag check(Tag tag) {
        Objects.requireNonNull(tag, "tag");
        if (tag.getType() != elementType) {
            throw new TagTypeMismatchException(elementType, tag.getType());
        }
        return tag;
    }

    public void add(Tag tag) {
        elements.add(check(tag));
    }

    public void add(int index, Tag tag) {
        elements.add(index, check(tag));
    }

    public Tag set(int index, Tag tag) {
        return elements.set(index, check(tag));
    }

    public Tag get(int index) {
        return elements.get(index);
    }

    public CompoundTag getCompound(int index) {
        return (CompoundTag) elements.get(index);
    }

    public Tag remove(int index) {
        return elements.remove(index);
    }

    public void clear() {
        elements.clear();
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public TagType getElementType() {
        return elementType;
    }

    /**
     * Read-only view of the elements.
     */
    public List<Tag> getValue() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Iterator<Tag> iterator() {
        return getValue().iterator();
    }

    @Override
    public TagType getType() {
        return TagType.LIST;
    }

    @Override
    public ListTag copy() {
        ListTag copy = new ListTag(elementType);
        for (Tag element : elements) {
            copy.elements.add(element.copy());
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListTag)) return false;
        ListTag other = (ListTag) o;
        return elementType == other.elementType && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return 31 * elementType.hashCode() + elements.hashCode();
    }
}
