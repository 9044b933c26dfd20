/**
 * Value types shared by every layer: audio format and buffer, the per-pass processing
 * context, and cooperative cancellation.
 *
 * @since 1.0
 */
package com.phillippitts.voicegraph.domain;
