package com.ryuqq.wsclient.adapter.invoker;

import com.ryuqq.wsclient.application.client.ClientCollaborators;
import com.ryuqq.wsclient.application.client.InvocationHandle;
import com.ryuqq.wsclient.application.client.PreparationHook;
import com.ryuqq.wsclient.application.client.SoapClient;
import com.ryuqq.wsclient.application.logging.MessageLogger;
import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.exception.HttpErrorException;
import com.ryuqq.wsclient.core.exception.InitializationException;
import com.ryuqq.wsclient.core.exception.InvalidInvocationException;
import com.ryuqq.wsclient.core.exception.MissingContractException;
import com.ryuqq.wsclient.core.exception.SoapFaultException;
import com.ryuqq.wsclient.core.model.Contract;
import com.ryuqq.wsclient.core.model.Locals;
import com.ryuqq.wsclient.core.model.Operation;
import com.ryuqq.wsclient.core.model.PreparedRequest;
import com.ryuqq.wsclient.core.model.RawResponse;
import com.ryuqq.wsclient.core.model.RequestSpec;
import com.ryuqq.wsclient.core.model.Response;
import com.ryuqq.wsclient.core.model.TransportState;
import com.ryuqq.wsclient.core.model.VerificationOutcome;
import com.ryuqq.wsclient.core.statemachine.InvocationEvent;
import com.ryuqq.wsclient.core.statemachine.InvocationState;
import com.ryuqq.wsclient.core.statemachine.InvocationTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * SoapClient 기본 구현체.
 *
 * <p><strong>생성 절차:</strong></p>
 * <ol>
 *   <li>전역 옵션 해석 (매핑이 아니면 LEGACY_CALL_SHAPE)</li>
 *   <li>customizer 적용 (검증 전)</li>
 *   <li>검증: contract location 또는 endpoint + namespace</li>
 *   <li>계약 1회 해석 (ContractResolver)</li>
 *   <li>HTTP / WS-Security 설정 초기화</li>
 * </ol>
 *
 * <p><strong>상태:</strong></p>
 * <ul>
 *   <li>options, contract: 생성 후 불변</li>
 *   <li>ambient 전송 상태: transportLock으로 보호 (스냅샷 복사, 쿠키 병합)</li>
 *   <li>대기 슬롯: pendingLock으로 보호, 인스턴스당 하나</li>
 *   <li>close 이후: 조회 외 모든 호출은 IllegalStateException</li>
 * </ul>
 *
 * <p>협력자 오류는 감싸지 않고 그대로 전파합니다. 스레드, 타이머, 재시도는 사용하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultSoapClient implements SoapClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultSoapClient.class);

    private final ClientOptions options;
    private final Contract contract;
    private final ClientCollaborators collaborators;
    private final MessageLogger messageLogger;
    private final TransportState ambient;
    private final Object transportLock = new Object();
    private final Object pendingLock = new Object();
    private final AtomicLong handleSequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private InvocationState state = InvocationState.NO_PENDING;
    private InvocationHandle pending;

    /**
     * 생성자 (customizer 없음).
     *
     * @param globals 전역 옵션 (ClientOptions 또는 snake_case 키 매핑)
     * @param collaborators 협력자
     * @throws InitializationException 옵션이 잘못되었거나 부족한 경우
     */
    public DefaultSoapClient(Object globals, ClientCollaborators collaborators) {
        this(globals, null, collaborators);
    }

    /**
     * 생성자.
     *
     * @param globals 전역 옵션 (ClientOptions 또는 snake_case 키 매핑)
     * @param customizer 검증 전에 옵션을 보완하는 설정 블록 (nullable)
     * @param collaborators 협력자
     * @throws IllegalArgumentException collaborators가 null인 경우
     * @throws InitializationException 옵션이 잘못되었거나 부족한 경우
     */
    public DefaultSoapClient(Object globals, Consumer<ClientOptions.Builder> customizer,
                             ClientCollaborators collaborators) {
        if (collaborators == null) {
            throw new IllegalArgumentException("collaborators cannot be null");
        }
        ClientOptions resolved = ClientOptions.from(globals);
        if (customizer != null) {
            ClientOptions.Builder builder = resolved.toBuilder();
            customizer.accept(builder);
            resolved = builder.build();
        }
        if (!resolved.hasContractLocation() && !resolved.hasEndpointAndNamespace()) {
            throw InitializationException.insufficientConfiguration();
        }

        Contract resolvedContract = collaborators.contractResolver().resolve(resolved);
        if (resolvedContract == null) {
            throw new IllegalStateException("ContractResolver returned no contract");
        }
        this.options = resolved;
        this.contract = resolvedContract;
        this.collaborators = collaborators;
        this.messageLogger = new MessageLogger(resolved);
        this.ambient = TransportState.from(resolved);
        log.info("SOAP client initialized: {}", resolvedContract);
    }

    @Override
    public ClientOptions options() {
        return options;
    }

    @Override
    public Contract contract() {
        return contract;
    }

    @Override
    public Set<String> operations() {
        requireDocument();
        return contract.operationNames();
    }

    @Override
    public String serviceName() {
        requireDocument();
        return contract.getServiceNameOrNull();
    }

    @Override
    public Operation operation(String name) {
        return Operation.create(name, contract, options);
    }

    @Override
    public Response call(String name, Locals locals) {
        ensureOpen();
        PreparedRequest request = collaborators.requestBuilder().build(operation(name), locals, snapshot());
        RawResponse raw = dispatch(request);
        return raiseErrors(Response.of(raw, VerificationOutcome.NOT_REQUESTED));
    }

    @Override
    public PreparedRequest buildRequest(String name, Locals locals) {
        ensureOpen();
        return collaborators.requestBuilder().build(operation(name), locals, snapshot());
    }

    @Override
    public InvocationHandle prepareInvocation(RequestSpec spec, PreparationHook hook) {
        if (spec == null) {
            throw new InvalidInvocationException(
                "prepareInvocation requires a RequestSpec naming the operation to invoke");
        }
        ensureOpen();
        PreparedRequest request = collaborators.requestBuilder()
            .build(operation(spec.operationName()), spec.locals(), snapshot());
        if (hook != null) {
            hook.afterBuild(PreparationHook.INITIAL_PASS, request);
        }

        InvocationHandle handle = new InvocationHandle(this, handleSequence.incrementAndGet(), request);
        synchronized (pendingLock) {
            if (InvocationTransition.discardsPending(state, InvocationEvent.PREPARE)) {
                log.warn("Discarding pending invocation {} ({}), replaced by invocation {}",
                    pending.getId(), pending.getRequest().getOperation().getName(), handle.getId());
            }
            state = InvocationTransition.next(state, InvocationEvent.PREPARE);
            pending = handle;
        }
        return handle;
    }

    @Override
    public Response finalizeInvocation() {
        ensureOpen();
        InvocationHandle handle;
        synchronized (pendingLock) {
            state = InvocationTransition.next(state, InvocationEvent.FINALIZE);
            handle = pending;
            pending = null;
        }
        return complete(handle);
    }

    @Override
    public Response finalizeInvocation(InvocationHandle handle) {
        if (handle == null) {
            throw new InvalidInvocationException(
                "finalizeInvocation requires the handle returned by prepareInvocation(...)");
        }
        if (!handle.isOwnedBy(this)) {
            throw new InvalidInvocationException(
                "Invocation " + handle.getId() + " was prepared by a different client");
        }
        ensureOpen();
        synchronized (pendingLock) {
            if (pending == handle) {
                state = InvocationTransition.next(state, InvocationEvent.FINALIZE);
                pending = null;
            }
        }
        return complete(handle);
    }

    @Override
    public TransportState transportState() {
        return snapshot();
    }

    /**
     * Transport 자원 해제 (최초 1회만 수행).
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            collaborators.transport().close();
            log.info("SOAP client closed: {}", contract);
        }
    }

    /**
     * 준비된 호출 전송 및 후처리.
     *
     * <ol>
     *   <li>핸들 점유 (재사용 시 NoPendingInvocationException)</li>
     *   <li>전송</li>
     *   <li>응답 쿠키를 ambient HTTP 설정에 병합</li>
     *   <li>verifyResponse 설정 시 서명 검증</li>
     *   <li>raiseErrors 정책 적용</li>
     * </ol>
     */
    private Response complete(InvocationHandle handle) {
        PreparedRequest request = handle.claim();
        RawResponse raw = dispatch(request);

        boolean verify;
        synchronized (transportLock) {
            ambient.http().setCookies(raw.cookies());
            verify = ambient.wsse().isVerifyResponse();
        }

        VerificationOutcome verification = VerificationOutcome.NOT_REQUESTED;
        if (verify) {
            collaborators.signatureVerifier().verify(raw.body());
            verification = VerificationOutcome.VERIFIED;
        }
        return raiseErrors(Response.of(raw, verification));
    }

    private RawResponse dispatch(PreparedRequest request) {
        messageLogger.logRequest(request);
        RawResponse raw = collaborators.transport().send(request);
        messageLogger.logResponse(raw);
        return raw;
    }

    private Response raiseErrors(Response response) {
        if (!options.raiseErrors()) {
            return response;
        }
        if (response.isSoapFault()) {
            throw new SoapFaultException(response, response.getFaultOrNull());
        }
        if (response.isHttpError()) {
            throw new HttpErrorException(response);
        }
        return response;
    }

    private TransportState snapshot() {
        synchronized (transportLock) {
            return ambient.copy();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("SoapClient is closed");
        }
    }

    private void requireDocument() {
        if (!contract.hasDocument()) {
            throw new MissingContractException("Unable to inspect the service without a WSDL document.");
        }
    }
}
