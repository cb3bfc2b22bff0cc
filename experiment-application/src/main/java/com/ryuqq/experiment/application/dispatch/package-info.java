/**
 * Dispatch pipeline: routing decision, error-policy candidates, decorated attempts, audit.
 *
 * <p>{@link com.ryuqq.experiment.application.dispatch.DefaultExperimentDispatcher} is the single
 * entry point used by proxies and direct callers. Routing precedence is activation gate,
 * experiment kill switch, selection, then trial kill switch.</p>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.application.dispatch;
