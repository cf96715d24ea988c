package com.example.payanalyzer.application.exception;

/**
 * Completes every request still pending when the processing worker shuts down.
 */
public class WorkerTerminatedException extends ApplicationException {

	/**
	 * @param requestId identifier of the rejected request
	 */
    public WorkerTerminatedException(String requestId) {
        super("Processing worker terminated before request " + requestId + " completed.");
    }
}
