package com.vidnyan.archgate.domain.model;

/**
 * One outbound reference as declared in source text.
 *
 * @param raw      the referenced text exactly as written, e.g. {@code ../svc/svc_uart.h} or {@code System.IO}
 * @param name     logical leaf name used for lookup, e.g. {@code svc_uart.h}
 * @param pathHint path-like form of the reference used to disambiguate candidates
 * @param line     1-based line of the declaration
 * @param system   true for references the dialect marks as system-provided ({@code #include <...>})
 */
public record RawReference(
    String raw,
    String name,
    String pathHint,
    int line,
    boolean system
) {

    /**
     * Reference whose path hint is the raw text itself.
     */
    public static RawReference of(String raw, String name, int line, boolean system) {
        return new RawReference(raw, name, raw, line, system);
    }
}
