/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.voicegraph.exception.VoiceGraphException} so callers can handle
 * them in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicegraph.exception.GraphException} - duplicate or unknown
 *       node/connection id; fatal to the call, never retried</li>
 *   <li>{@link com.phillippitts.voicegraph.exception.ConnectionIncompatibleException} -
 *       connection validation found mismatched formats or capabilities</li>
 *   <li>{@link com.phillippitts.voicegraph.exception.PipelineExecutionException} - wraps any
 *       failure of a propagation pass; {@link com.phillippitts.voicegraph.exception.NoEntryPointsException}
 *       is the case of a pipeline without enabled entry points</li>
 *   <li>{@link com.phillippitts.voicegraph.exception.TransportException} - socket failures,
 *       including {@link com.phillippitts.voicegraph.exception.NotConnectedException}</li>
 *   <li>{@link com.phillippitts.voicegraph.exception.UnsupportedConversionException} and
 *       {@link com.phillippitts.voicegraph.exception.UnsupportedMixFormatException} - local,
 *       non-fatal audio format problems</li>
 * </ul>
 *
 * <p>Cancellation of a pass is not an error and has no exception type.
 *
 * @since 1.0
 */
package com.phillippitts.voicegraph.exception;
