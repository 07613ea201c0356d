package edu.northeastern.hanafeng.matrixreloaded.client;

/**
 * Successful outcomes of a login request.
 * A failed request is reported through {@link ChatClientException}.
 */
public enum LoginStatus {
    LOGGED_IN,
    NOT_REGISTERED
}
