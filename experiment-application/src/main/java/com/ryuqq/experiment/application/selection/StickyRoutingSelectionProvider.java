package com.ryuqq.experiment.application.selection;

import com.ryuqq.experiment.core.model.SelectionMode;
import com.ryuqq.experiment.core.routing.StickyTrialRouter;
import com.ryuqq.experiment.core.spi.SelectionContext;
import com.ryuqq.experiment.core.spi.SelectionModeProvider;
import com.ryuqq.experiment.core.spi.SubjectIdentityProvider;

import java.util.Optional;

/**
 * {@code StickyRouting} 모드.
 *
 * <p>같은 Subject는 Trial 구성이 바뀌지 않는 한 항상 같은 Trial을 받습니다.
 * Subject가 없는 호출은 기본 Trial로 라우팅됩니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 * @see StickyTrialRouter
 */
public final class StickyRoutingSelectionProvider implements SelectionModeProvider {

    private final SubjectIdentityProvider subjectIdentityProvider;

    public StickyRoutingSelectionProvider(SubjectIdentityProvider subjectIdentityProvider) {
        if (subjectIdentityProvider == null) {
            throw new IllegalArgumentException("subjectIdentityProvider cannot be null");
        }
        this.subjectIdentityProvider = subjectIdentityProvider;
    }

    @Override
    public String modeIdentifier() {
        return SelectionMode.STICKY_ROUTING.builtInIdentifier();
    }

    @Override
    public Optional<String> selectTrialKey(SelectionContext context) {
        return subjectIdentityProvider.currentSubjectId(context.resolutionContext())
            .filter(subject -> !subject.isBlank())
            .map(subject -> StickyTrialRouter.selectTrial(subject, context.selectorName(), context.trialKeys()));
    }
}
