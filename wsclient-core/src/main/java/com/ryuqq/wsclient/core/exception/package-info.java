/**
 * 클라이언트 오류 타입.
 *
 * <p>모든 예외는 {@link com.ryuqq.wsclient.core.exception.SoapClientException}을 상속하며
 * {@link com.ryuqq.wsclient.core.exception.ErrorKind}로 분류됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.core.exception;
