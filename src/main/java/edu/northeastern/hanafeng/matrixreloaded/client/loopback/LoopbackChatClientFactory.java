package edu.northeastern.hanafeng.matrixreloaded.client.loopback;

import edu.northeastern.hanafeng.matrixreloaded.client.ChatClient;
import edu.northeastern.hanafeng.matrixreloaded.client.ChatClientFactory;
import edu.northeastern.hanafeng.matrixreloaded.client.ClientOptions;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class LoopbackChatClientFactory implements ChatClientFactory {

    private final LoopbackHomeserver homeserver;

    @Override
    public ChatClient create(String userId, ClientOptions options) {
        return new LoopbackChatClient(homeserver, userId, options);
    }
}
