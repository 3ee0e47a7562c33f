package com.ryuqq.wsclient.core.model;

import com.ryuqq.wsclient.core.config.ClientOptions;

/**
 * 호출 단위의 원격 operation.
 *
 * <p>operation 이름 + 소속 계약 + 전역 옵션의 조합이며, 디스패치할 때마다 새로 생성됩니다.
 * 캐시되지 않고 호출 간 상태를 갖지 않으므로 사용 후 버려도 됩니다.</p>
 *
 * <p>이름이 계약에 실제로 선언되었는지는 여기서 검사하지 않습니다.
 * 존재 여부 검증은 요청 빌더의 책임입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Operation {

    private final String name;
    private final Contract contract;
    private final ClientOptions options;

    private Operation(String name, Contract contract, ClientOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("operation name cannot be null or blank");
        }
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        this.name = name;
        this.contract = contract;
        this.options = options;
    }

    /**
     * Operation 생성.
     *
     * @param name operation 이름
     * @param contract 해석된 계약
     * @param options 전역 옵션
     * @return 새 Operation
     * @throws IllegalArgumentException 인자가 null이거나 name이 blank인 경우
     */
    public static Operation create(String name, Contract contract, ClientOptions options) {
        return new Operation(name, contract, options);
    }

    public String getName() {
        return name;
    }

    public Contract getContract() {
        return contract;
    }

    public ClientOptions getOptions() {
        return options;
    }

    /**
     * 계약에 선언된 operation인지 확인.
     *
     * @return 문서가 있고 이름이 선언된 경우 true
     */
    public boolean isDeclared() {
        return contract.hasDocument() && contract.findOperation(name).isPresent();
    }

    public OperationDescriptor getDescriptorOrNull() {
        return contract.findOperation(name).orElse(null);
    }

    @Override
    public String toString() {
        return "Operation{" + name + "}";
    }
}
