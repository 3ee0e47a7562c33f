/**
 * SOAP 메시지 로깅 (SLF4J DEBUG).
 */
package com.ryuqq.wsclient.application.logging;
