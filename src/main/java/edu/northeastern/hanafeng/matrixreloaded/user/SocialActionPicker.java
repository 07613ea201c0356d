package edu.northeastern.hanafeng.matrixreloaded.user;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Chooses what an idle syncing user does next.
 * Each trial draws independently and only runs when every earlier trial failed.
 */
public class SocialActionPicker {

    static final double LOG_OUT_PROBABILITY = 1.0 / 50;
    static final double UPDATE_STATUS_PROBABILITY = 1.0 / 25;
    static final double ADD_FRIEND_PROBABILITY = 1.0 / 3;

    private final DoubleSupplier uniform;

    public SocialActionPicker() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param uniform source of values in [0, 1)
     */
    public SocialActionPicker(DoubleSupplier uniform) {
        this.uniform = uniform;
    }

    public SocialAction pick() {
        if (uniform.getAsDouble() < LOG_OUT_PROBABILITY) {
            return SocialAction.LOG_OUT;
        }
        if (uniform.getAsDouble() < UPDATE_STATUS_PROBABILITY) {
            return SocialAction.UPDATE_STATUS;
        }
        if (uniform.getAsDouble() < ADD_FRIEND_PROBABILITY) {
            return SocialAction.ADD_FRIEND;
        }
        return SocialAction.SEND_MESSAGE;
    }
}
