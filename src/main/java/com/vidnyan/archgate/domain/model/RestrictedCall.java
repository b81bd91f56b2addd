package com.vidnyan.archgate.domain.model;

/**
 * A call to an API that only lower roles may use, as found in source text.
 *
 * @param api    the API as matched, e.g. {@code Thread.Sleep}
 * @param reason what the API does that Intent must not do
 * @param line   1-based line of the call
 */
public record RestrictedCall(
    String api,
    String reason,
    int line
) {}
