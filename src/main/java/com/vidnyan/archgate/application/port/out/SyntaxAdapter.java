package com.vidnyan.archgate.application.port.out;

import com.vidnyan.archgate.domain.model.SyntaxExtraction;

import java.util.List;
import java.util.Set;

/**
 * Port for one source dialect. Extracts outbound references and structural signals from file text.
 * <p>
 * Implementations are stateless and thread-safe. {@link #extract} never throws: text it
 * cannot parse yields {@link SyntaxExtraction#failed}.
 * </p>
 */
public interface SyntaxAdapter {

    /**
     * Stable dialect id, used in stage names.
     */
    String dialectId();

    /**
     * Lower-case file extensions with leading dot, e.g. {@code .c}.
     */
    Set<String> fileExtensions();

    /**
     * Namespaces an Intent file of this dialect must never import.
     */
    default List<String> forbiddenIntentNamespaces() {
        return List.of();
    }

    /**
     * @param text        full file text
     * @param dialectHint lower-case extension of the file, with leading dot
     */
    SyntaxExtraction extract(String text, String dialectHint);
}
