package com.ryuqq.experiment.core.decorator;

import com.ryuqq.experiment.core.context.ResolutionContext;

/**
 * Registry 빌드 시 Decorator 인스턴스를 만드는 Factory.
 *
 * <p>Factory는 등록 순서대로 적용되며, 먼저 등록된 Decorator가 바깥쪽에 위치합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExperimentDecoratorFactory {

    /**
     * Decorator 생성.
     *
     * @param context Registry의 루트 Resolution Context
     * @return Decorator
     */
    ExperimentDecorator create(ResolutionContext context);

    /**
     * 이미 만들어진 Decorator를 그대로 반환하는 Factory.
     *
     * @param decorator Decorator
     * @return Factory
     */
    static ExperimentDecoratorFactory of(ExperimentDecorator decorator) {
        if (decorator == null) {
            throw new IllegalArgumentException("decorator cannot be null");
        }
        return context -> decorator;
    }
}
