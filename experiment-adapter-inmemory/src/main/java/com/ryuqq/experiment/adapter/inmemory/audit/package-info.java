/**
 * In-memory audit sink and outcome store.
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.adapter.inmemory.audit;
