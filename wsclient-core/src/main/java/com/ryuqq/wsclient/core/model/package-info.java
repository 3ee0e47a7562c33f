/**
 * 호출 모델.
 *
 * <p>계약(Contract), 호출 단위 Operation, 준비된 요청(PreparedRequest), 응답(Response) 등
 * 컨트롤러와 어댑터가 주고받는 값 타입을 정의합니다.</p>
 *
 * <h2>가변성</h2>
 * <ul>
 *   <li>불변: Contract, Operation, Locals, RequestSpec, RawResponse, Response</li>
 *   <li>가변: PreparedRequest (전송 전까지), TransportState 내부 설정</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.core.model;
