package edu.northeastern.hanafeng.matrixreloaded.client;

/**
 * Raised when a homeserver request fails: transport errors, timeouts
 * and server-side errors alike.
 */
public class ChatClientException extends Exception {

    public ChatClientException(String message) {
        super(message);
    }

    public ChatClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
