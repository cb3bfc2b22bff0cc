/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the pluggable collaborators the dispatch core consults on every call.
 * Adapter modules (experiment-adapter-inmemory, or a persistence adapter) provide implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.experiment.core.spi.KillSwitchProvider} - runtime override to the default trial</li>
 *   <li>{@link com.ryuqq.experiment.core.spi.KillSwitchStore} - persistence behind a write-through kill switch</li>
 *   <li>{@link com.ryuqq.experiment.core.spi.SelectionModeProvider} - trial key resolution per selection mode</li>
 *   <li>{@link com.ryuqq.experiment.core.spi.FeatureFlagSource}, {@link com.ryuqq.experiment.core.spi.VariantFlagSource},
 *       {@link com.ryuqq.experiment.core.spi.ConfigurationSource} - inputs of the built-in modes</li>
 *   <li>{@link com.ryuqq.experiment.core.spi.SubjectIdentityProvider} - subject for sticky routing</li>
 *   <li>{@link com.ryuqq.experiment.core.spi.ActivationPredicate} - custom activation condition</li>
 *   <li>{@link com.ryuqq.experiment.core.spi.AuditSink} - one event per completed call</li>
 *   <li>{@link com.ryuqq.experiment.core.spi.OutcomeStore} - outcome records</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Fail soft on the hot path:</strong> provider failures become a default-trial routing decision</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.core.spi;
