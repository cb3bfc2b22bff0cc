package com.ryuqq.experiment.core.routing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Subject 식별자 기반 결정적 Trial 배정.
 *
 * <p>같은 Subject, 같은 Selector, 같은 Trial 집합이면 어느 프로세스에서든
 * 항상 같은 Trial이 선택됩니다. 공유 상태나 외부 저장소를 사용하지 않습니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * hash   = SHA-256(subjectId + ":" + selectorName)
 * bucket = unsigned(hash[0..3], big-endian) mod trialKeys.size()
 * result = sort(trialKeys)[bucket]
 * </pre>
 *
 * <p>Trial Key를 정렬하므로 입력 순서와 무관합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class StickyTrialRouter {

    private static final String HASH_ALGORITHM = "SHA-256";

    private StickyTrialRouter() {
    }

    /**
     * Trial 선택.
     *
     * @param subjectId Subject 식별자 (예: 사용자 ID)
     * @param selectorName Selector 이름 (Experiment마다 다른 분배를 만드는 salt)
     * @param trialKeys 후보 Trial Key
     * @return 선택된 Trial Key
     * @throws IllegalArgumentException subjectId 또는 selectorName이 null인 경우
     * @throws IllegalStateException trialKeys가 비어 있는 경우
     */
    public static String selectTrial(String subjectId, String selectorName, Collection<String> trialKeys) {
        if (subjectId == null) {
            throw new IllegalArgumentException("subjectId cannot be null");
        }
        if (selectorName == null) {
            throw new IllegalArgumentException("selectorName cannot be null");
        }
        if (trialKeys == null || trialKeys.isEmpty()) {
            throw new IllegalStateException("No trial keys available for sticky routing.");
        }

        List<String> sorted = new ArrayList<>(trialKeys);
        sorted.sort(null);

        long bucket = bucketOf(subjectId + ":" + selectorName) % sorted.size();
        return sorted.get((int) bucket);
    }

    /**
     * 입력 문자열의 해시 버킷 값 (0 ~ 2^32-1).
     *
     * @param input 해시 입력
     * @return unsigned 32bit 값
     */
    static long bucketOf(String input) {
        byte[] hash = digest(input.getBytes(StandardCharsets.UTF_8));
        return ((long) (hash[0] & 0xFF) << 24)
            | ((hash[1] & 0xFF) << 16)
            | ((hash[2] & 0xFF) << 8)
            | (hash[3] & 0xFF);
    }

    private static byte[] digest(byte[] input) {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM).digest(input);
        } catch (NoSuchAlgorithmException e) {
            // 모든 JDK는 SHA-256을 제공해야 함
            throw new IllegalStateException(HASH_ALGORITHM + " not available", e);
        }
    }
}
