package com.ryuqq.experiment.core.spi;

import com.ryuqq.experiment.core.context.ResolutionContext;

import java.util.Optional;

/**
 * Supplies the stable subject identifier (user id, session id) for sticky routing.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SubjectIdentityProvider {

    /**
     * Returns the subject for the current call.
     *
     * @param context the current call's resolution context
     * @return subject id, empty if the call has no subject
     */
    Optional<String> currentSubjectId(ResolutionContext context);
}
