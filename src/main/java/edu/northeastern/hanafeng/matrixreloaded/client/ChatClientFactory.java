package edu.northeastern.hanafeng.matrixreloaded.client;

/**
 * Builds one {@link ChatClient} per simulated user.
 */
public interface ChatClientFactory {

    ChatClient create(String userId, ClientOptions options) throws ChatClientException;
}
