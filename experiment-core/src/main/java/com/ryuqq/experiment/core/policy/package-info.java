/**
 * Error Policy package.
 *
 * <p>Each policy is a pure function from (preferred key, default key, declared trial keys) to
 * the ordered list of keys to attempt. The executor in the application layer walks this list,
 * stopping at the first success.</p>
 *
 * <h2>Policies</h2>
 * <ul>
 *   <li>{@link com.ryuqq.experiment.core.policy.Throw} - no fallback</li>
 *   <li>{@link com.ryuqq.experiment.core.policy.RedirectAndReplayDefault} - one retry on the default trial</li>
 *   <li>{@link com.ryuqq.experiment.core.policy.RedirectAndReplayAny} - remaining trials in registration order</li>
 *   <li>{@link com.ryuqq.experiment.core.policy.RedirectAndReplay} - one retry on a named trial</li>
 *   <li>{@link com.ryuqq.experiment.core.policy.RedirectAndReplayOrdered} - listed trials in order</li>
 * </ul>
 *
 * <p>No policy ever lists the same key twice.</p>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.core.policy;
