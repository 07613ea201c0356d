package edu.northeastern.hanafeng.matrixreloaded.client;

/**
 * Successful outcomes of a registration request.
 * A failed request is reported through {@link ChatClientException}.
 */
public enum RegistrationStatus {
    REGISTERED,
    ALREADY_EXISTS
}
