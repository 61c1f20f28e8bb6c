package org.example.assessment.service;

/**
 * External asynchronous scoring network. Accepts a request, returns its id immediately and later
 * fulfils it exactly once by publishing an {@link EvaluationFulfilledEvent}.
 */
public interface EvaluationNetwork {

    /**
     * Submit a request for evaluation.
     *
     * @param request the evaluation routine, its configuration and arguments
     * @return a unique {@code 0x}-prefixed 256-bit request id
     */
    String sendRequest(EvaluationRequest request);

    /**
     * Check whether the network can currently accept and fulfil requests.
     */
    boolean isAvailable();

    String getNetworkName();

    default int getQueueDepth() {
        return 0;
    }

    default boolean isWorkerRunning() {
        return true;
    }
}
