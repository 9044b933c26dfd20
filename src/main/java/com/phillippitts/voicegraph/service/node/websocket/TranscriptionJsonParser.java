package com.phillippitts.voicegraph.service.node.websocket;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Parses transcription messages of the form {@code {"text": "...", "is_final": true}}.
 * Safe against malformed input: anything unparsable yields an empty result.
 */
final class TranscriptionJsonParser {

    private TranscriptionJsonParser() {}

    /**
     * A parsed transcript.
     */
    record Transcript(String text, boolean isFinal) {
    }

    static Optional<Transcript> parse(String json) {
        return parse(json, false);
    }

    /**
     * @param finalByDefault value used when the message carries no {@code is_final} flag
     */
    static Optional<Transcript> parse(String json, boolean finalByDefault) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (!obj.has("text")) {
                return Optional.empty();
            }
            String text = obj.optString("text", "").trim();
            if (text.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Transcript(text, obj.optBoolean("is_final", finalByDefault)));
        } catch (JSONException e) {
            return Optional.empty();
        }
    }
}
