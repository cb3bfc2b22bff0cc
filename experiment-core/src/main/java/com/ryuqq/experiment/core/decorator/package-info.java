/**
 * Decorator (middleware) 계약.
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.core.decorator;
