package com.ryuqq.experiment.core.spi;

import com.ryuqq.experiment.core.model.KillSwitchState;

/**
 * Persistence SPI backing a write-through kill switch.
 *
 * <p>The in-process kill switch stays authoritative: a failed {@link #save} is logged by the
 * caller and never rolls back or blocks the in-memory toggle.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public interface KillSwitchStore {

    /**
     * Loads the persisted state at startup.
     *
     * @return the stored state ({@link KillSwitchState#EMPTY} if nothing was stored)
     */
    KillSwitchState load();

    /**
     * Persists a full snapshot of the current state.
     *
     * @param state the snapshot to store
     */
    void save(KillSwitchState state);
}
