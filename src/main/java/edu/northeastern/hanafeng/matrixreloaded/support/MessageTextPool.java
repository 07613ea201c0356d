package edu.northeastern.hanafeng.matrixreloaded.support;

import java.util.concurrent.ThreadLocalRandom;

public final class MessageTextPool {
  private MessageTextPool() {}

  public static final String[] MESSAGES = new String[]{
      "hi","hello","ok","good","thx","bye","yo","hey","kk","lol",
      "done","cool","wow","yay","ping","pong","brb","afk","gg","+1",
      "how are you doing today?",
      "anyone around for a quick call?",
      "did the federation catch up yet?",
      "just joined, what did I miss?",
      "sync looks slow from here, anyone else?",
      "sending this from the train, sorry for typos",
      "the new room is up, invite whoever needs it",
      "reminder: standup moved to 10:30",
      "who is on call this week?",
      "that room history is getting long",
      "This is a longer message meant to look like someone explaining something in more detail than a quick reply. It should make payload sizes less uniform across the run.",
      "Another medium-long message so that not every event looks identical in size. Real rooms mix one-word replies with paragraphs, and the homeserver has to persist and fan out both.",
      "Pasting a snippet here: the worker logs say the event was persisted but the sync response never included it, so either the stream position was wrong or the client dropped it on the floor.",
      "This is a deliberately long chat message to push event sizes up. Long messages exercise event persistence, federation payloads and sync response sizes all at once, which is exactly the kind of load that shows up in busy rooms during an incident when everybody pastes stack traces and links at the same time.",
      "thanks for the invite!",
      "see you all tomorrow",
      "typing from my phone",
      "can someone pin that?",
      "happy testing!"
  };

  public static final String[] STATUSES = new String[]{
      "online", "busy", "in a meeting", "on vacation", "focusing", "away", "lunch"
  };

  public static String randomMessage() {
    return MESSAGES[ThreadLocalRandom.current().nextInt(MESSAGES.length)];
  }

  public static String randomStatus() {
    return STATUSES[ThreadLocalRandom.current().nextInt(STATUSES.length)];
  }
}
