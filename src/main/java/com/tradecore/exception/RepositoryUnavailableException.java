package com.tradecore.exception;

/** The durable tier of a repository could not be reached or initialised. */
public class RepositoryUnavailableException extends BaseException {

    public RepositoryUnavailableException(String message) {
        super(ErrorCode.REPOSITORY_UNAVAILABLE, message);
    }

    public RepositoryUnavailableException(String message, Throwable cause) {
        super(ErrorCode.REPOSITORY_UNAVAILABLE, message, cause);
    }
}
