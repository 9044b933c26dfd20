package com.phillippitts.voicegraph.service.registry;

import com.phillippitts.voicegraph.service.node.Node;

/**
 * Constructor function registered for one node type key.
 */
@FunctionalInterface
public interface NodeFactory {

    Node create(String id, String name);
}
