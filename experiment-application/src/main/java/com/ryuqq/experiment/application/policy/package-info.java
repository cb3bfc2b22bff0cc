/**
 * Error policy execution and per-call cancellation.
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.application.policy;
