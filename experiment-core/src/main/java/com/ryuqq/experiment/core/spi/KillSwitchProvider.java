package com.ryuqq.experiment.core.spi;

/**
 * Kill Switch SPI: runtime override that forces routing to the default trial.
 *
 * <p>The dispatcher reads this store on every call, so reads must be cheap and safe under
 * concurrent writers. Writes are rare (operator action, automated rollback).</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: reads may run concurrently with writes</li>
 *   <li>Non-blocking for unrelated keys: toggling one switch must not stall dispatch decisions</li>
 *   <li>Idempotent: disabling an already disabled key (or enabling an enabled one) is a no-op</li>
 * </ul>
 *
 * <p><strong>Dispatcher semantics:</strong></p>
 * <ul>
 *   <li>Experiment disabled → default trial, selection mode is not evaluated</li>
 *   <li>Selected trial disabled → default trial for that call, the selected key is still audited</li>
 * </ul>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public interface KillSwitchProvider {

    /**
     * Checks whether the whole experiment for a service type is disabled.
     *
     * @param serviceType the experiment's service interface
     * @return true if disabled
     */
    boolean isExperimentDisabled(Class<?> serviceType);

    /**
     * Checks whether a single trial is disabled.
     *
     * @param serviceType the experiment's service interface
     * @param trialKey the trial key
     * @return true if disabled
     */
    boolean isTrialDisabled(Class<?> serviceType, String trialKey);

    /**
     * Disables the whole experiment.
     *
     * @param serviceType the experiment's service interface
     * @throws IllegalArgumentException if serviceType is null
     */
    void disableExperiment(Class<?> serviceType);

    /**
     * Re-enables the whole experiment.
     *
     * @param serviceType the experiment's service interface
     * @throws IllegalArgumentException if serviceType is null
     */
    void enableExperiment(Class<?> serviceType);

    /**
     * Disables a single trial.
     *
     * @param serviceType the experiment's service interface
     * @param trialKey the trial key
     * @throws IllegalArgumentException if serviceType or trialKey is null
     */
    void disableTrial(Class<?> serviceType, String trialKey);

    /**
     * Re-enables a single trial.
     *
     * @param serviceType the experiment's service interface
     * @param trialKey the trial key
     * @throws IllegalArgumentException if serviceType or trialKey is null
     */
    void enableTrial(Class<?> serviceType, String trialKey);
}
