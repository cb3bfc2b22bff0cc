package com.ryuqq.experiment.adapter.inmemory.source;

import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.spi.SubjectIdentityProvider;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * {@link SubjectIdentityProvider} bound to the calling thread.
 *
 * <p>The subject is read on the thread that enters the dispatcher, which is where selection
 * happens, so async trials that continue on other threads still route by the caller's subject.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * subjects.runAs("user-42", () -&gt; pricing.quote(cart));
 * </pre>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public class ThreadLocalSubjectIdentityProvider implements SubjectIdentityProvider {

    private final ThreadLocal<String> current = new ThreadLocal<>();

    @Override
    public Optional<String> currentSubjectId(ResolutionContext context) {
        return Optional.ofNullable(current.get());
    }

    public void set(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId cannot be null or blank");
        }
        current.set(subjectId);
    }

    public void clear() {
        current.remove();
    }

    /**
     * Runs an action with a subject bound, restoring the previous binding afterwards.
     *
     * @param subjectId subject for the duration of the action
     * @param action the action
     * @param <T> result type
     * @return the action's result
     * @throws Exception whatever the action throws
     */
    public <T> T runAs(String subjectId, Callable<T> action) throws Exception {
        String previous = current.get();
        set(subjectId);
        try {
            return action.call();
        } finally {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
    }
}
