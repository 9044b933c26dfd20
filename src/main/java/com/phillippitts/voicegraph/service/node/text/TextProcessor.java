package com.phillippitts.voicegraph.service.node.text;

import com.phillippitts.voicegraph.domain.ProcessingContext;

/**
 * One step of a {@link TextProcessingNode} chain.
 */
@FunctionalInterface
public interface TextProcessor {

    /**
     * @return the transformed text, or {@code null} to drop it
     */
    String process(String text, ProcessingContext context);
}
