/**
 * SOAP Envelope 작성 (메시지 변환, WS-Security 헤더).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.adapter.wsdl.envelope;
