package com.ryuqq.wsclient.application.client;

import com.ryuqq.wsclient.core.exception.NoPendingInvocationException;
import com.ryuqq.wsclient.core.model.PreparedRequest;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 준비된 호출 핸들.
 *
 * <p>prepareInvocation이 반환하며, finalizeInvocation에서 정확히 한 번 사용됩니다.</p>
 *
 * <p><strong>사용 규칙:</strong></p>
 * <ul>
 *   <li>{@link #claim()}은 최초 1회만 성공</li>
 *   <li>두 번째 claim은 NoPendingInvocationException</li>
 *   <li>요청 자체는 전송 전까지 변경 가능 (hook 또는 {@link #getRequest()})</li>
 *   <li>핸들을 만든 클라이언트만 finalize 가능 ({@link #isOwnedBy(Object)})</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InvocationHandle {

    private final Object owner;
    private final long id;
    private final PreparedRequest request;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    /**
     * 생성자.
     *
     * @param owner 핸들을 만든 클라이언트
     * @param id 클라이언트 내 고유 ID
     * @param request 준비된 요청
     * @throws IllegalArgumentException owner 또는 request가 null인 경우
     */
    public InvocationHandle(Object owner, long id, PreparedRequest request) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        this.owner = owner;
        this.id = id;
        this.request = request;
    }

    public boolean isOwnedBy(Object client) {
        return owner == client;
    }

    public long getId() {
        return id;
    }

    public PreparedRequest getRequest() {
        return request;
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    /**
     * 전송을 위해 요청 점유.
     *
     * @return 준비된 요청
     * @throws NoPendingInvocationException 이미 사용된 핸들인 경우
     */
    public PreparedRequest claim() {
        if (!consumed.compareAndSet(false, true)) {
            throw new NoPendingInvocationException(
                "Invocation " + id + " was already finalized. Call prepareInvocation(...) again.");
        }
        return request;
    }

    @Override
    public String toString() {
        return "InvocationHandle{id=" + id + ", operation=" + request.getOperation().getName()
            + ", consumed=" + consumed.get() + "}";
    }
}
