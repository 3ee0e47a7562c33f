package com.ryuqq.wsclient.adapter.wsdl;

import com.ryuqq.wsclient.core.config.ClientOptions;
import com.ryuqq.wsclient.core.config.HttpSettings;
import com.ryuqq.wsclient.core.model.Contract;
import com.ryuqq.wsclient.core.spi.ContractResolver;
import com.ryuqq.wsclient.core.spi.DocumentLoader;

import java.net.URI;

/**
 * WSDL 기반 ContractResolver.
 *
 * <p><strong>해석 규칙:</strong></p>
 * <ul>
 *   <li>contract location이 있으면 문서를 로드하여 파싱</li>
 *   <li>endpoint / namespace 옵션은 지정된 경우에만 문서 값을 덮어씀</li>
 *   <li>location이 없으면 문서 없는 계약 (endpoint + namespace)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WsdlContractResolver implements ContractResolver {

    private final DocumentLoader documentLoader;
    private final WsdlParser parser;

    public WsdlContractResolver(DocumentLoader documentLoader) {
        this(documentLoader, new WsdlParser());
    }

    public WsdlContractResolver(DocumentLoader documentLoader, WsdlParser parser) {
        if (documentLoader == null) {
            throw new IllegalArgumentException("documentLoader cannot be null");
        }
        if (parser == null) {
            throw new IllegalArgumentException("parser cannot be null");
        }
        this.documentLoader = documentLoader;
        this.parser = parser;
    }

    @Override
    public Contract resolve(ClientOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        String adapter = options.adapter().orElse(null);
        if (!options.hasContractLocation()) {
            return Contract.withoutDocument(options.endpoint().orElse(null), options.namespace().orElse(null), adapter);
        }

        String location = options.contractLocation().get();
        WsdlDocument document = parser.parse(documentLoader.load(location, HttpSettings.from(options)));
        URI endpoint = options.endpoint().orElse(document.endpoint());
        String namespace = options.namespace().orElse(document.targetNamespace());
        return Contract.documented(document.operations(), document.serviceName(), namespace, endpoint, adapter);
    }
}
