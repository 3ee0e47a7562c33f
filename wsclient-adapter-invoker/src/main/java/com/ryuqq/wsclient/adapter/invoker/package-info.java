/**
 * Invoker Adapter - SoapClient 구현체와 기본 구성.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wsclient.adapter.invoker.DefaultSoapClient} - 클라이언트 컨트롤러</li>
 *   <li>{@link com.ryuqq.wsclient.adapter.invoker.AdapterRoutingTransport} - adapter 옵션별 전송 선택</li>
 *   <li>{@link com.ryuqq.wsclient.adapter.invoker.SoapClients} - 기본 협력자 조립</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.adapter.invoker;
