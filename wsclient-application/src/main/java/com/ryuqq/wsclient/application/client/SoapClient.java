package com.ryuqq.wsclient.application.client;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.exception.InvalidInvocationException;
import com.ryuqq.wsclient.core.model.Contract;
import com.ryuqq.wsclient.core.model.Locals;
import com.ryuqq.wsclient.core.model.Operation;
import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.RequestSpec;
import com.ryuqq.wsclient.core.model.Response;
import com.ryuqq.wsclient.core.model.TransportState;

import java.util.Set;

/**
 * SOAP 서비스 클라이언트 컨트롤러.
 *
 * <p>하나의 서비스 계약(WSDL 또는 endpoint + namespace)에 바인딩되어
 * 계약 조회, 단일 호출, 2단계(prepare/finalize) 호출을 제공합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SoapClient client = SoapClients.create(Map.of("wsdl", "http://example.com/service?wsdl"));
 * Set&lt;String&gt; operations = client.operations();
 *
 * // 단일 호출
 * Response response = client.call("GetQuote", Locals.message(Map.of("symbol", "ACME")));
 *
 * // 2단계 호출
 * InvocationHandle handle = client.prepareInvocation(RequestSpec.of("GetQuote"),
 *     (pass, request) -&gt; request.setHeader("X-Trace", "abc"));
 * Response verified = client.finalizeInvocation(handle);
 *
 * client.close();
 * </pre>
 *
 * <p><strong>스레드 안전성:</strong></p>
 * <ul>
 *   <li>조회/단일 호출: 동시 호출 가능</li>
 *   <li>대기 슬롯(pending): 인스턴스당 하나, 락으로 보호</li>
 *   <li>명시적 핸들 finalize: 다른 호출자의 슬롯에 영향 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SoapClient extends AutoCloseable {

    /**
     * 구성 옵션 조회.
     *
     * @return 검증된 ClientOptions
     */
    ClientOptions options();

    /**
     * 해석된 서비스 계약 조회.
     *
     * @return Contract (생성 시 1회 해석)
     */
    Contract contract();

    /**
     * 계약에 선언된 operation 이름 목록.
     *
     * @return 수정 불가능한 operation 이름 집합
     * @throws com.ryuqq.wsclient.core.exception.MissingContractException WSDL 문서가 없는 경우
     */
    Set<String> operations();

    /**
     * 서비스 이름 조회.
     *
     * @return WSDL에 선언된 서비스 이름
     * @throws com.ryuqq.wsclient.core.exception.MissingContractException WSDL 문서가 없는 경우
     */
    String serviceName();

    /**
     * Operation 값 생성.
     *
     * <p>호출마다 새로운 값을 반환합니다. 이름의 존재 여부는 요청 빌드 시점에 검증됩니다.</p>
     *
     * @param name operation 이름
     * @return 새 Operation
     */
    Operation operation(String name);

    /**
     * 단일 단계 호출.
     *
     * <p>쿠키 전파와 응답 서명 검증은 수행하지 않습니다.</p>
     *
     * @param name operation 이름
     * @param locals 호출별 옵션
     * @return Response
     * @throws com.ryuqq.wsclient.core.exception.SoapFaultException raiseErrors 설정 시 SOAP Fault
     * @throws com.ryuqq.wsclient.core.exception.HttpErrorException raiseErrors 설정 시 HTTP 오류
     */
    Response call(String name, Locals locals);

    default Response call(String name) {
        return call(name, Locals.empty());
    }

    /**
     * 전송 없이 요청만 빌드.
     *
     * @param name operation 이름
     * @param locals 호출별 옵션
     * @return PreparedRequest (격리된 TransportState 사본 포함)
     */
    PreparedRequest buildRequest(String name, Locals locals);

    /**
     * 2단계 호출 준비.
     *
     * <p>요청을 빌드하고 hook을 즉시 실행한 뒤 핸들을 대기 슬롯에 보관합니다.
     * 이미 대기 중인 핸들이 있으면 교체됩니다.</p>
     *
     * @param spec 호출 대상 (operation 이름 + locals)
     * @param hook 빌드 직후 실행되는 hook (nullable)
     * @return InvocationHandle
     * @throws com.ryuqq.wsclient.core.exception.InvalidInvocationException spec이 null인 경우
     */
    InvocationHandle prepareInvocation(RequestSpec spec, PreparationHook hook);

    default InvocationHandle prepareInvocation(RequestSpec spec) {
        return prepareInvocation(spec, null);
    }

    /**
     * locals 없이 2단계 호출 준비.
     *
     * @param operationName operation 이름
     * @return InvocationHandle
     * @throws InvalidInvocationException operationName이 null이거나 비어 있는 경우
     */
    default InvocationHandle prepareInvocation(String operationName) {
        if (operationName == null || operationName.isBlank()) {
            throw new InvalidInvocationException(
                "prepareInvocation requires an operation name, but was: " + operationName);
        }
        return prepareInvocation(RequestSpec.of(operationName), null);
    }

    /**
     * 대기 중인 호출 실행.
     *
     * <p>전송 후 응답 쿠키를 클라이언트 HTTP 설정에 병합하고,
     * verifyResponse 설정 시 응답 서명을 검증합니다.</p>
     *
     * @return Response
     * @throws com.ryuqq.wsclient.core.exception.NoPendingInvocationException 대기 중인 호출이 없는 경우
     * @throws com.ryuqq.wsclient.core.exception.SignatureVerificationException 서명 검증 실패
     */
    Response finalizeInvocation();

    /**
     * 명시적 핸들로 호출 실행.
     *
     * @param handle prepareInvocation이 반환한 핸들
     * @return Response
     * @throws com.ryuqq.wsclient.core.exception.InvalidInvocationException handle이 null이거나
     *         다른 클라이언트가 준비한 핸들인 경우
     * @throws com.ryuqq.wsclient.core.exception.NoPendingInvocationException 이미 사용된 핸들인 경우
     */
    Response finalizeInvocation(InvocationHandle handle);

    /**
     * 현재 전송 상태의 사본.
     *
     * @return TransportState 사본 (변경해도 클라이언트에 영향 없음)
     */
    TransportState transportState();

    /**
     * 전송 자원(커넥션 풀) 해제.
     *
     * <p>여러 번 호출해도 안전합니다. 닫힌 뒤의 호출과 전송은 IllegalStateException으로 실패합니다.</p>
     */
    @Override
    void close();
}
