package org.dxworks.structogram.model;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out identifiers for a single parse or edit call.
 * Identifiers already present in the tree being edited are skipped, so fresh ids never
 * collide with existing ones.
 */
public final class IdGenerator {
    private final String prefix;
    private final Set<String> taken;
    private int counter;

    public IdGenerator(String prefix) {
        this(prefix, Set.of());
    }

    public IdGenerator(String prefix, Set<String> taken) {
        this.prefix = prefix;
        this.taken = new HashSet<>(taken);
    }

    /** Generator for edits of {@code tree}: avoids every identifier already used there. */
    public static IdGenerator forTree(String prefix, Node tree) {
        return new IdGenerator(prefix, Nodes.collectIds(tree));
    }

    public String next() {
        String id;
        do {
            id = prefix + (++counter);
        } while (!taken.add(id));
        return id;
    }
}
