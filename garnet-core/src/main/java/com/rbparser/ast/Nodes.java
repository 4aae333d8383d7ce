package com.rbparser.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Helpers shared by the node records.
 */
public final class Nodes {

    private Nodes() {
    }

    /**
     * Flattens single children and child lists into one list, dropping nulls.
     */
    public static List<Node> of(Object... parts) {
        List<Node> nodes = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                nodes.add(node);
            } else if (part instanceof Collection<?> collection) {
                for (Object element : collection) {
                    if (element instanceof Node node) {
                        nodes.add(node);
                    } else if (element != null) {
                        nodes.addAll(of(element));
                    }
                }
            } else if (part instanceof Params.OptionalParam optional) {
                nodes.addAll(of(optional.name(), optional.value()));
            } else if (part instanceof Params.KeywordParam keyword) {
                nodes.addAll(of(keyword.name(), keyword.value()));
            } else if (part instanceof HshPtn.Entry entry) {
                nodes.addAll(of(entry.key(), entry.value()));
            }
        }
        return nodes;
    }
}
