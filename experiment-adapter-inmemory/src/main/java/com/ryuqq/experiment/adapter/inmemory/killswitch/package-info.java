/**
 * Kill switch adapters.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.experiment.adapter.inmemory.killswitch.InMemoryKillSwitchProvider} - default, read/write lock</li>
 *   <li>{@link com.ryuqq.experiment.adapter.inmemory.killswitch.WriteThroughKillSwitchProvider} - in-memory + fire-and-forget persistence</li>
 *   <li>{@link com.ryuqq.experiment.adapter.inmemory.killswitch.InMemoryKillSwitchStore} - reference store</li>
 * </ul>
 *
 * <p>Both providers pass {@code AbstractKillSwitchContractTest} from experiment-testkit.</p>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.adapter.inmemory.killswitch;
