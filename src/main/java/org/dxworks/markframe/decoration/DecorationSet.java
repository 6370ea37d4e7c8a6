package org.dxworks.markframe.decoration;

import java.util.Iterator;
import java.util.List;

/**
 * Immutable, ordered render instructions for one document state.
 */
public final class DecorationSet implements Iterable<RenderInstruction> {

    private static final DecorationSet EMPTY = new DecorationSet(List.of());

    private final List<RenderInstruction> instructions;

    DecorationSet(List<RenderInstruction> instructions) {
        this.instructions = List.copyOf(instructions);
    }

    public static DecorationSet empty() {
        return EMPTY;
    }

    public List<RenderInstruction> instructions() {
        return instructions;
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    @Override
    public Iterator<RenderInstruction> iterator() {
        return instructions.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecorationSet other)) return false;
        return instructions.equals(other.instructions);
    }

    @Override
    public int hashCode() {
        return instructions.hashCode();
    }

    @Override
    public String toString() {
        return "DecorationSet" + instructions;
    }
}
