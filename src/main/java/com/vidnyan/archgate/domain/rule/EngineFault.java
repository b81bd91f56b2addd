package com.vidnyan.archgate.domain.rule;

/**
 * A rule that crashed while inspecting one file. Never counted as a finding.
 */
public record EngineFault(
    String ruleId,
    String path,
    String message
) {}
