package com.ryuqq.wsclient.core.statemachine;

/**
 * 2단계 호출(prepare/finalize)의 클라이언트 단위 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NO_PENDING ──PREPARE──► PENDING
 *     ▲                     │ │
 *     └──────FINALIZE───────┘ └──PREPARE──► PENDING (이전 핸들 폐기)
 *
 * 금지된 전이:
 * - NO_PENDING ──FINALIZE──► ❌ (보낼 요청 없음)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum InvocationState {

    /**
     * 준비된 호출 없음.
     */
    NO_PENDING,

    /**
     * 준비된 호출이 전송을 기다리는 중.
     */
    PENDING;

    public boolean hasPending() {
        return this == PENDING;
    }
}
