/**
 * Spring configuration: configuration properties, thread pools, the shared HTTP/WebSocket
 * client and the built-in node-type registrations.
 */
package com.phillippitts.voicegraph.config;
