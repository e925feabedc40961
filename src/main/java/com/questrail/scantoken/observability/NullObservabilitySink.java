package com.questrail.scantoken.observability;

/**
 * No-op implementation of TokenObservabilitySink.
 */
public final class NullObservabilitySink implements TokenObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTokenGenerated(TokenGeneratedEvent event) {}

    @Override
    public void onValidationFailure(ValidationFailureEvent event) {}

    @Override
    public void onDetection(DetectionEvent event) {}

    @Override
    public void onError(TokenErrorEvent event) {}
}
