package com.example.signal.service;

/**
 * Internal fault of the analysis pipeline, such as a malformed keyword table. Never raised for
 * bad input; callers use it to tell an internal bug apart from a rejected event.
 */
public class SignalAnalysisException extends RuntimeException {

    public SignalAnalysisException(String message) {
        super(message);
    }

    public SignalAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
