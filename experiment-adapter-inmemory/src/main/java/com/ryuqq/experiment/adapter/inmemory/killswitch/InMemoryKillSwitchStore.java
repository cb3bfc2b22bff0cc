package com.ryuqq.experiment.adapter.inmemory.killswitch;

import com.ryuqq.experiment.core.model.KillSwitchState;
import com.ryuqq.experiment.core.spi.KillSwitchStore;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link KillSwitchStore} SPI for testing and reference purposes.
 *
 * <p>Keeps the last saved snapshot. Useful to simulate a restart: build a new
 * {@link WriteThroughKillSwitchProvider} over the same store.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public class InMemoryKillSwitchStore implements KillSwitchStore {

    private final AtomicReference<KillSwitchState> state = new AtomicReference<>(KillSwitchState.EMPTY);
    private final AtomicInteger saveCount = new AtomicInteger();

    @Override
    public KillSwitchState load() {
        return state.get();
    }

    @Override
    public void save(KillSwitchState newState) {
        if (newState == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        state.set(newState);
        saveCount.incrementAndGet();
    }

    /**
     * Number of successful saves since creation.
     *
     * @return save count
     */
    public int getSaveCount() {
        return saveCount.get();
    }
}
