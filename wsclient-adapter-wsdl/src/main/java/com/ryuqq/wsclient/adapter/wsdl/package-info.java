/**
 * WSDL Adapter - 서비스 계약 해석.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wsclient.adapter.wsdl.WsdlContractResolver} - ContractResolver 구현</li>
 *   <li>{@link com.ryuqq.wsclient.adapter.wsdl.WsdlParser} - WSDL 1.1 DOM 파서</li>
 *   <li>{@link com.ryuqq.wsclient.adapter.wsdl.LocalDocumentLoader} - 인라인/파일/classpath 로더</li>
 *   <li>{@link com.ryuqq.wsclient.adapter.wsdl.RoutingDocumentLoader} - 로컬/원격 분기</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.adapter.wsdl;
