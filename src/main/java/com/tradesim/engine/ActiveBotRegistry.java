package com.tradesim.engine;

import com.tradesim.model.BotState;
import com.tradesim.model.BotStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds at most one running bot per user, and the final status of the last bot
 * each user ran so that status queries keep answering after the task is gone.
 */
public class ActiveBotRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ActiveBotRegistry.class);

    private final Map<String, BotInstance> active = new ConcurrentHashMap<>();
    private final Map<String, BotStatus> lastStatus = new ConcurrentHashMap<>();
    private final Clock clock;

    public ActiveBotRegistry() {
        this(Clock.systemUTC());
    }

    public ActiveBotRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Atomically claim the user's slot.
     *
     * @return false when another bot already holds it
     */
    public boolean tryStart(String userId, BotInstance instance) {
        return active.putIfAbsent(userId, instance) == null;
    }

    /**
     * Cooperative stop: the cycle in flight may finish, no new cycle starts.
     *
     * @return the status after stopping, or the last known status when nothing was running
     */
    public BotStatus stop(String userId) {
        BotInstance instance = active.get(userId);
        if (instance == null) {
            return status(userId);
        }
        if (instance.terminate(BotState.STOPPED, "Stopped by user", clock.instant(), false)) {
            logger.info("🛑 Bot {} for {} stopped after {} cycles", instance.getStrategy().getId(), userId,
                    instance.getCycleCount());
        }
        finish(instance);
        return status(userId);
    }

    /**
     * Forced termination: the task thread is interrupted and nothing further is
     * applied to the ledger.
     */
    public BotStatus abort(String userId, BotState terminal, String reason) {
        BotInstance instance = active.get(userId);
        if (instance == null) {
            return status(userId);
        }
        instance.terminate(terminal, reason, clock.instant(), true);
        finish(instance);
        return status(userId);
    }

    /**
     * Release the user's slot if it is still held by this instance, remembering its final status.
     */
    void finish(BotInstance instance) {
        lastStatus.put(instance.getUserId(), instance.toStatus());
        active.remove(instance.getUserId(), instance);
    }

    public BotStatus status(String userId) {
        BotInstance instance = active.get(userId);
        if (instance != null) {
            return instance.toStatus();
        }
        return lastStatus.getOrDefault(userId, BotStatus.notRunning());
    }

    public boolean isActive(String userId) {
        return active.containsKey(userId);
    }

    public Optional<BotInstance> get(String userId) {
        return Optional.ofNullable(active.get(userId));
    }

    public int activeCount() {
        return active.size();
    }

    Map<String, BotInstance> activeInstances() {
        return active;
    }
}
