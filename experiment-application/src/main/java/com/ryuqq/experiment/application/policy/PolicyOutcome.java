package com.ryuqq.experiment.application.policy;

/**
 * Error Policy 실행 결과.
 *
 * <p>정책 실행은 항상 정상 완료되고, 성공/실패는 이 값으로 구분합니다.
 * 실패한 경우에도 마지막으로 실행된 Trial Key가 남아 있어 Audit에 사용할 수 있습니다.</p>
 * <ul>
 *   <li>{@link Succeeded}: 어느 한 Trial이 성공</li>
 *   <li>{@link Failed}: 모든 후보가 실패했거나 호출자가 취소</li>
 * </ul>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public sealed interface PolicyOutcome permits PolicyOutcome.Succeeded, PolicyOutcome.Failed {

    /**
     * 결과를 만든 (마지막으로 실행된) Trial Key.
     *
     * @return Trial Key
     */
    String executedKey();

    /**
     * 실제로 시작된 시도 횟수.
     *
     * @return 시도 횟수 (0 이상)
     */
    int attempts();

    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    /**
     * 성공.
     *
     * @param executedKey 성공한 Trial Key
     * @param value 결과 값 (null 가능)
     * @param attempts 시도 횟수
     */
    record Succeeded(String executedKey, Object value, int attempts) implements PolicyOutcome {

        public Succeeded {
            if (executedKey == null) {
                throw new IllegalArgumentException("executedKey cannot be null");
            }
            // value는 null 허용 (void 메서드)
        }
    }

    /**
     * 최종 실패.
     *
     * @param executedKey 마지막으로 실행된 Trial Key
     * @param cause 호출자에게 전달할 예외 (마지막 시도의 예외)
     * @param attempts 시도 횟수
     */
    record Failed(String executedKey, Throwable cause, int attempts) implements PolicyOutcome {

        public Failed {
            if (executedKey == null) {
                throw new IllegalArgumentException("executedKey cannot be null");
            }
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }
    }
}
