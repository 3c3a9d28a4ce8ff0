package com.tradesim.engine;

/**
 * Thrown by {@link BotScheduler#start} when the user already owns a running bot.
 */
public class BotAlreadyRunningException extends IllegalStateException {

    private final String userId;

    public BotAlreadyRunningException(String userId) {
        super("A bot is already running for user " + userId);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
