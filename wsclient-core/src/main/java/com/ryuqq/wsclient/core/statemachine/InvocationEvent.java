package com.ryuqq.wsclient.core.statemachine;

/**
 * 2단계 호출 상태를 바꾸는 사건.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum InvocationEvent {

    /** 요청 준비 (pending 슬롯 교체). */
    PREPARE,

    /** 준비된 요청 전송 (pending 슬롯 소비). */
    FINALIZE
}
