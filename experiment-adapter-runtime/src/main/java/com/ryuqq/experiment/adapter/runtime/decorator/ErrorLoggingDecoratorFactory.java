package com.ryuqq.experiment.adapter.runtime.decorator;

import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.decorator.ExperimentDecorator;
import com.ryuqq.experiment.core.decorator.ExperimentDecoratorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;

/**
 * 실패한 시도를 ERROR 로그로 남기는 Decorator.
 *
 * <p>결과와 예외는 바꾸지 않습니다. Fallback이 뒤따르는 경우에도 실패한 시도마다 한 줄씩 기록됩니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class ErrorLoggingDecoratorFactory implements ExperimentDecoratorFactory {

    private static final Logger log = LoggerFactory.getLogger(ErrorLoggingDecoratorFactory.class);

    @Override
    public ExperimentDecorator create(ResolutionContext context) {
        return (invocation, next) -> next.proceed().whenComplete((value, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
                log.error("Experiment trial failed: experiment='{}' service={} method={} trial='{}' selected='{}' attempt={}",
                    invocation.experimentName(), invocation.serviceType().getName(), invocation.methodName(),
                    invocation.trialKey(), invocation.selectedKey(), invocation.attempt(), cause);
            }
        });
    }
}
