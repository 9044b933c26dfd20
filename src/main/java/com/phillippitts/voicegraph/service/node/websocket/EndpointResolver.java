package com.phillippitts.voicegraph.service.node.websocket;

import java.net.URI;

/**
 * Session-setup step run before each connect. Lets a node exchange its configured endpoint
 * for the URI it should actually open (for example a per-call join URL).
 */
@FunctionalInterface
public interface EndpointResolver {

    /** Connects to the configured endpoint as is. */
    EndpointResolver DIRECT = configured -> configured;

    /**
     * @throws com.phillippitts.voicegraph.exception.TransportException if setup fails
     */
    URI resolve(URI configuredEndpoint);
}
