package io.docflow.core.plan;

/// Whether executions of a plan own an external conversation thread.
///
/// @param ownsThread `true` if each execution opens its own thread
/// @param threadPurpose purpose label for the thread, may be null
public record ThreadOwnership(boolean ownsThread, String threadPurpose) {

    public static final ThreadOwnership NONE = new ThreadOwnership(false, null);
}
