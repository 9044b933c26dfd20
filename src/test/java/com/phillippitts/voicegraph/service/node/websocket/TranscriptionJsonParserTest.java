package com.phillippitts.voicegraph.service.node.websocket;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptionJsonParserTest {

    @Test
    void parsesTextAndFinalFlag() {
        assertThat(TranscriptionJsonParser.parse("{\"text\": \" hello \", \"is_final\": true}"))
                .contains(new TranscriptionJsonParser.Transcript("hello", true));
    }

    @Test
    void finalFlagDefaultsToFalse() {
        assertThat(TranscriptionJsonParser.parse("{\"text\": \"hel\"}"))
                .contains(new TranscriptionJsonParser.Transcript("hel", false));
    }

    @Test
    void emptyOrMissingTextYieldsNothing() {
        assertThat(TranscriptionJsonParser.parse("{\"text\": \"   \"}")).isEmpty();
        assertThat(TranscriptionJsonParser.parse("{\"partial\": \"x\"}")).isEmpty();
        assertThat(TranscriptionJsonParser.parse("")).isEmpty();
        assertThat(TranscriptionJsonParser.parse(null)).isEmpty();
    }

    @Test
    void malformedJsonYieldsNothing() {
        assertThat(TranscriptionJsonParser.parse("{not json")).isEmpty();
    }
}
