package com.ryuqq.experiment.adapter.inmemory.killswitch;

import com.ryuqq.experiment.core.model.KillSwitchState;
import com.ryuqq.experiment.core.spi.KillSwitchProvider;
import com.ryuqq.experiment.core.spi.KillSwitchStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Persistent kill switch: in-memory state plus fire-and-forget write-through to a {@link KillSwitchStore}.
 *
 * <p><strong>Lifecycle:</strong></p>
 * <ol>
 *   <li>Construction: state is loaded once from the store (a failing load starts empty, WARN)</li>
 *   <li>Reads: served from memory only, the store is never consulted on the dispatch path</li>
 *   <li>Mutations: applied in memory first, then a persist task is handed to the executor</li>
 * </ol>
 *
 * <p><strong>Failure handling:</strong> a failed or rejected persist is logged at WARN and dropped.
 * The in-memory toggle stays in effect; the next successful persist writes the full current state,
 * so a dropped write is repaired by any later mutation.</p>
 *
 * <p>Each persist task snapshots the state when it runs, under a lock shared by all persist tasks,
 * so the store never moves back to an older state even when the executor reorders tasks.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public class WriteThroughKillSwitchProvider implements KillSwitchProvider {

    private static final Logger log = LoggerFactory.getLogger(WriteThroughKillSwitchProvider.class);

    private final InMemoryKillSwitchProvider delegate;
    private final KillSwitchStore store;
    private final Executor executor;
    private final Object persistLock = new Object();

    /**
     * Creates the provider and loads the persisted state.
     *
     * @param store the backing store
     * @param executor executor for persist tasks (use {@code Runnable::run} for synchronous writes)
     * @throws IllegalArgumentException if store or executor is null
     */
    public WriteThroughKillSwitchProvider(KillSwitchStore store, Executor executor) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.store = store;
        this.executor = executor;
        this.delegate = new InMemoryKillSwitchProvider(loadInitialState(store));
    }

    @Override
    public boolean isExperimentDisabled(Class<?> serviceType) {
        return delegate.isExperimentDisabled(serviceType);
    }

    @Override
    public boolean isTrialDisabled(Class<?> serviceType, String trialKey) {
        return delegate.isTrialDisabled(serviceType, trialKey);
    }

    @Override
    public void disableExperiment(Class<?> serviceType) {
        delegate.disableExperiment(serviceType);
        persist();
    }

    @Override
    public void enableExperiment(Class<?> serviceType) {
        delegate.enableExperiment(serviceType);
        persist();
    }

    @Override
    public void disableTrial(Class<?> serviceType, String trialKey) {
        delegate.disableTrial(serviceType, trialKey);
        persist();
    }

    @Override
    public void enableTrial(Class<?> serviceType, String trialKey) {
        delegate.enableTrial(serviceType, trialKey);
        persist();
    }

    /**
     * Returns an immutable copy of the in-memory state.
     *
     * @return snapshot
     */
    public KillSwitchState snapshot() {
        return delegate.snapshot();
    }

    private void persist() {
        try {
            executor.execute(this::saveCurrentState);
        } catch (RejectedExecutionException e) {
            log.warn("Kill switch persist task rejected, in-memory state remains authoritative", e);
        }
    }

    private void saveCurrentState() {
        synchronized (persistLock) {
            try {
                store.save(delegate.snapshot());
            } catch (RuntimeException e) {
                log.warn("Kill switch persist failed, in-memory state remains authoritative", e);
            }
        }
    }

    private static KillSwitchState loadInitialState(KillSwitchStore store) {
        try {
            KillSwitchState state = store.load();
            if (state == null) {
                return KillSwitchState.EMPTY;
            }
            log.info("Kill switch state loaded: {} experiment(s), {} trial(s) disabled",
                state.disabledExperiments().size(), state.disabledTrials().size());
            return state;
        } catch (RuntimeException e) {
            log.warn("Kill switch state load failed, starting with nothing disabled", e);
            return KillSwitchState.EMPTY;
        }
    }
}
