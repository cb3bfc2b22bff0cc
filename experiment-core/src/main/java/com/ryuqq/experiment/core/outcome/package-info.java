/**
 * Outcome 측정 모델.
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.core.outcome;
