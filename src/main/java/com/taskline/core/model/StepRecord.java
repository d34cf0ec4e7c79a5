package com.taskline.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One step of an agent's reasoning or execution trace.
 *
 * @param action     what the agent did
 * @param reasoning  why it did it
 * @param confidence self-reported certainty in [0,1], nullable
 * @param timestamp  when the step happened, nullable
 * @param outcome    free-form result of the step, nullable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepRecord(
    String action,
    String reasoning,
    Double confidence,
    Instant timestamp,
    String outcome
) {}
