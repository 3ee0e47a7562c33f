/**
 * WS-Security Adapter - 응답 XML 서명 검증 (JDK XML Digital Signature API).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.adapter.wsse;
