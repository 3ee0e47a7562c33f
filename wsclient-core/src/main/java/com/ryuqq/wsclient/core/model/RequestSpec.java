package com.ryuqq.wsclient.core.model;

/**
 * 2단계 호출 대상 지정.
 *
 * @param operationName 호출할 operation 이름
 * @param locals 호출 단위 옵션 (null이면 {@link Locals#empty()})
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RequestSpec(String operationName, Locals locals) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException operationName이 null이거나 blank인 경우
     */
    public RequestSpec {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (locals == null) {
            locals = Locals.empty();
        }
    }

    public static RequestSpec of(String operationName) {
        return new RequestSpec(operationName, Locals.empty());
    }

    public static RequestSpec of(String operationName, Locals locals) {
        return new RequestSpec(operationName, locals);
    }
}
