/**
 * HTTP Adapter - Apache HttpClient 5 기반 전송 및 WSDL 로드.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.adapter.http;
