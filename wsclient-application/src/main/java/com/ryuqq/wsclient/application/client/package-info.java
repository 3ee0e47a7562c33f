/**
 * SOAP Client Application Layer - 호출 조정 API.
 *
 * <p>서비스 계약 조회, 단일 호출, 2단계(prepare/finalize) 호출의 포트를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wsclient.application.client.SoapClient} - 클라이언트 컨트롤러</li>
 *   <li>{@link com.ryuqq.wsclient.application.client.InvocationHandle} - 준비된 호출 핸들 (1회용)</li>
 *   <li>{@link com.ryuqq.wsclient.application.client.PreparationHook} - 빌드 직후 hook</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-invoker 모듈에 위치</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.application.client;
