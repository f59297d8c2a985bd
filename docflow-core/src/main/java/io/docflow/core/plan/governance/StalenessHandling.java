package io.docflow.core.plan.governance;

/// How a plan reacts when upstream documents change after this one was produced.
///
/// @param autoReentry whether the workflow re-enters automatically, null if undeclared
/// @param refreshOption name of the refresh option offered, may be null
/// @param description free text, may be null
public record StalenessHandling(Boolean autoReentry, String refreshOption, String description) {}
