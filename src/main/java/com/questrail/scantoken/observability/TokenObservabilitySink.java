package com.questrail.scantoken.observability;

/**
 * Main interface for receiving token codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Implementations must be thread-safe: generator, validator and detector
 * may all report from concurrent callers.</p>
 */
public interface TokenObservabilitySink {
    /**
     * Called after a token has been generated.
     * @param event the generation details
     */
    void onTokenGenerated(TokenGeneratedEvent event);

    /**
     * Called when a candidate is rejected (malformed, checksum mismatch, or
     * unallocated component).
     * @param event the failure details
     */
    void onValidationFailure(ValidationFailureEvent event);

    /**
     * Called when the detector confirms a token in scanned text.
     * @param event the detection
     */
    void onDetection(DetectionEvent event);

    /**
     * Called when an external collaborator fails.
     * @param event the error event
     */
    void onError(TokenErrorEvent event);
}
