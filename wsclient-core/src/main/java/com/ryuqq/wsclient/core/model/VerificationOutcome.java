package com.ryuqq.wsclient.core.model;

/**
 * 응답 서명 검증 결과.
 *
 * <p>검증 실패는 결과 값이 아니라 예외로 전달되므로 FAILED 상태는 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum VerificationOutcome {

    /** 설정상 검증을 요청하지 않음. */
    NOT_REQUESTED,

    /** 서명 검증 성공. */
    VERIFIED
}
