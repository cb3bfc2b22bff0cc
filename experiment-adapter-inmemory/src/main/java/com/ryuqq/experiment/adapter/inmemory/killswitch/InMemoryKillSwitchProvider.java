package com.ryuqq.experiment.adapter.inmemory.killswitch;

import com.ryuqq.experiment.core.model.DisabledTrial;
import com.ryuqq.experiment.core.model.KillSwitchState;
import com.ryuqq.experiment.core.spi.KillSwitchProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;

/**
 * In-memory implementation of {@link KillSwitchProvider} SPI.
 *
 * <p>This is the default kill switch: state lives in two hash sets guarded by a single
 * {@link ReentrantReadWriteLock}. Dispatch decisions take the read lock, so any number of them
 * run concurrently; a toggle takes the write lock only for the duration of one set update.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>disabledExperiments:</strong> Set&lt;Class&lt;?&gt;&gt; - whole experiments forced to the default trial</li>
 *   <li><strong>disabledTrials:</strong> Set&lt;DisabledTrial&gt; - (service type, trial key) pairs</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>isExperimentDisabled / isTrialDisabled:</strong> O(1) under a shared read lock</li>
 *   <li><strong>disable / enable:</strong> O(1) under the write lock</li>
 *   <li><strong>snapshot:</strong> O(N) copy under the read lock</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>State lost on process restart (wrap with {@link WriteThroughKillSwitchProvider} to persist)</li>
 *   <li>Scoped to one process, replicas do not share toggles</li>
 * </ul>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public class InMemoryKillSwitchProvider implements KillSwitchProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKillSwitchProvider.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Set<Class<?>> disabledExperiments = new HashSet<>();
    private final Set<DisabledTrial> disabledTrials = new HashSet<>();

    /**
     * Creates a provider with nothing disabled.
     */
    public InMemoryKillSwitchProvider() {
    }

    /**
     * Creates a provider initialised from a snapshot.
     *
     * @param initialState the state to start from
     * @throws IllegalArgumentException if initialState is null
     */
    public InMemoryKillSwitchProvider(KillSwitchState initialState) {
        restore(initialState);
    }

    @Override
    public boolean isExperimentDisabled(Class<?> serviceType) {
        lock.readLock().lock();
        try {
            return disabledExperiments.contains(serviceType);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isTrialDisabled(Class<?> serviceType, String trialKey) {
        if (serviceType == null || trialKey == null || trialKey.isEmpty()) {
            return false;
        }
        lock.readLock().lock();
        try {
            return disabledTrials.contains(new DisabledTrial(serviceType, trialKey));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void disableExperiment(Class<?> serviceType) {
        requireServiceType(serviceType);
        if (write(() -> disabledExperiments.add(serviceType))) {
            log.info("Kill switch: experiment {} disabled", serviceType.getName());
        }
    }

    @Override
    public void enableExperiment(Class<?> serviceType) {
        requireServiceType(serviceType);
        if (write(() -> disabledExperiments.remove(serviceType))) {
            log.info("Kill switch: experiment {} enabled", serviceType.getName());
        }
    }

    @Override
    public void disableTrial(Class<?> serviceType, String trialKey) {
        DisabledTrial trial = new DisabledTrial(serviceType, trialKey);
        if (write(() -> disabledTrials.add(trial))) {
            log.info("Kill switch: trial '{}' of {} disabled", trialKey, serviceType.getName());
        }
    }

    @Override
    public void enableTrial(Class<?> serviceType, String trialKey) {
        DisabledTrial trial = new DisabledTrial(serviceType, trialKey);
        if (write(() -> disabledTrials.remove(trial))) {
            log.info("Kill switch: trial '{}' of {} enabled", trialKey, serviceType.getName());
        }
    }

    /**
     * Returns an immutable copy of the current state.
     *
     * @return snapshot
     */
    public KillSwitchState snapshot() {
        lock.readLock().lock();
        try {
            return new KillSwitchState(disabledExperiments, disabledTrials);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the current state with a snapshot.
     *
     * @param state the state to restore
     * @throws IllegalArgumentException if state is null
     */
    public void restore(KillSwitchState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        lock.writeLock().lock();
        try {
            disabledExperiments.clear();
            disabledExperiments.addAll(state.disabledExperiments());
            disabledTrials.clear();
            disabledTrials.addAll(state.disabledTrials());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Re-enables everything.
     */
    public void clear() {
        restore(KillSwitchState.EMPTY);
    }

    private boolean write(BooleanSupplier mutation) {
        lock.writeLock().lock();
        try {
            return mutation.getAsBoolean();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void requireServiceType(Class<?> serviceType) {
        if (serviceType == null) {
            throw new IllegalArgumentException("serviceType cannot be null");
        }
    }
}
