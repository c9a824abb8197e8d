package com.toycon.graph.script;

import com.toycon.graph.api.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable name to current producer node. Lives for one compilation.
 *
 * Rebinding replaces the producer; earlier readers keep the node they already
 * wired, which is what gives scripts their single-assignment flavour.
 */
final class SymbolTable {
    private final Map<String, Node> bindings = new LinkedHashMap<>();

    Node resolve(String name) {
        return bindings.get(name);
    }

    void bind(String name, Node producer) {
        bindings.put(name, producer);
    }

    Map<String, Node> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }
}
