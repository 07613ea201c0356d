package edu.northeastern.hanafeng.matrixreloaded.client;

import java.time.Duration;

/**
 * Per-client request settings.
 *
 * @param homeserverUrl  full URL of the server under test
 * @param retryEnabled   whether the client itself retries failed requests
 * @param requestTimeout timeout of a single request
 */
public record ClientOptions(String homeserverUrl, boolean retryEnabled, Duration requestTimeout) {
}
