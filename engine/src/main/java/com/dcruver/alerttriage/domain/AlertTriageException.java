package com.dcruver.alerttriage.domain;

/**
 * Failure of a collaborator (repository, embedding model, chat) while matching or clustering.
 */
public class AlertTriageException extends RuntimeException {

    public AlertTriageException(String message) {
        super(message);
    }

    public AlertTriageException(String message, Throwable cause) {
        super(message, cause);
    }
}
