package com.phillippitts.voicegraph.service.node;

/**
 * Capabilities a node can declare. Routing dispatches on the presence of a capability, not
 * on a node's position in a class hierarchy.
 */
public enum NodeCapability {
    /** Accepts audio buffers; registered as a pipeline entry point. */
    AUDIO_INPUT,
    /** Yields processed audio; registered as a pipeline exit point. */
    AUDIO_OUTPUT,
    /** Maintains a long-lived transport between start and stop of streaming. */
    STREAMING
}
