/**
 * In-memory selection inputs: feature flags, variant flags, configuration values, subject identity.
 *
 * <p>Intended for tests and single-process setups; production deployments plug in their
 * flag service or configuration system through the same SPI.</p>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.adapter.inmemory.source;
