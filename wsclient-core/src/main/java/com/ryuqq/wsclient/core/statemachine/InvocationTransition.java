package com.ryuqq.wsclient.core.statemachine;

import com.ryuqq.wsclient.core.exception.NoPendingInvocationException;

/**
 * 2단계 호출 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>NO_PENDING --PREPARE--&gt; PENDING</li>
 *   <li>PENDING --PREPARE--&gt; PENDING (이전 핸들은 폐기됨)</li>
 *   <li>PENDING --FINALIZE--&gt; NO_PENDING</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 준비된 호출 없이 FINALIZE 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InvocationTransition {

    // Utility class - prevent instantiation
    private InvocationTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 다음 상태 계산.
     *
     * @param current 현재 상태
     * @param event 발생한 사건
     * @return 전이된 상태
     * @throws IllegalArgumentException current 또는 event가 null인 경우
     * @throws NoPendingInvocationException NO_PENDING 상태에서 FINALIZE 한 경우
     */
    public static InvocationState next(InvocationState current, InvocationEvent event) {
        if (current == null || event == null) {
            throw new IllegalArgumentException("State and event cannot be null (state: " + current + ", event: " + event + ")");
        }

        if (event == InvocationEvent.PREPARE) {
            return InvocationState.PENDING;
        }

        if (!current.hasPending()) {
            throw new NoPendingInvocationException(
                "No prepared invocation to finalize. Call prepareInvocation(...) first.");
        }
        return InvocationState.NO_PENDING;
    }

    /**
     * PREPARE가 아직 전송되지 않은 핸들을 덮어쓰는지 확인.
     *
     * @param current 현재 상태
     * @param event 발생한 사건
     * @return PENDING 상태에서 PREPARE인 경우 true
     */
    public static boolean discardsPending(InvocationState current, InvocationEvent event) {
        return current == InvocationState.PENDING && event == InvocationEvent.PREPARE;
    }
}
