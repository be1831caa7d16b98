package com.coordinator.dispatch.api;

/**
 * Inbound JSON body for task completion and failure reports.
 *
 * @param result success payload (complete)
 * @param error  failure message (fail)
 */
public record TaskOutcomeRequest(
    String result,
    String error
) {}
