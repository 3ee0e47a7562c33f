package com.ryuqq.wsclient.testkit.contract;

import com.ryuqq.wsclient.application.client.ClientCollaborators;
import com.ryuqq.wsclient.application.client.SoapClient;
import com.ryuqq.wsclient.core.exception.ErrorKind;
import com.ryuqq.wsclient.core.exception.InitializationException;
import com.ryuqq.wsclient.core.exception.MissingContractException;
import com.ryuqq.wsclient.core.exception.UnknownOperationException;
import com.ryuqq.wsclient.core.model.Contract;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: client construction and contract resolution.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>The contract is resolved exactly once per client</li>
 *   <li>Operations are listed in declaration order</li>
 *   <li>Undeclared operations fail before anything is sent</li>
 *   <li>Without a document, introspection fails but calls still work</li>
 *   <li>Invalid global options fail construction</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ContractResolutionContractTest extends DefaultClientContractSupport {

    @Test
    void testResolution_ResolvedOncePerClient() {
        // Given: a client
        SoapClient client = newClient();

        // When: several operations are used
        client.call("Ping");
        client.call("Status");
        client.operations();

        // Then: the resolver ran once
        assertEquals(1, contractResolver.resolutionCount());
        assertSendCount(2);
    }

    @Test
    void testResolution_OperationsInDeclarationOrder() {
        // Given
        SoapClient client = newClient();

        // When/Then
        assertEquals(List.of("Ping", "Status"), List.copyOf(client.operations()));
        assertEquals(SERVICE_NAME, client.serviceName());
    }

    @Test
    void testResolution_UndeclaredOperation_NothingSent() {
        // Given
        SoapClient client = newClient();

        // When/Then
        UnknownOperationException exception = assertThrows(UnknownOperationException.class,
                () -> client.call("Reboot"));
        assertEquals(ErrorKind.UNKNOWN_OPERATION, exception.kind());
        assertEquals("Reboot", exception.getOperationName());
        assertSendCount(0);
    }

    @Test
    void testResolution_WithoutDocument_CallsAnyOperation() {
        // Given: endpoint and namespace only
        SoapClient client = createClient(
                Map.of("endpoint", ENDPOINT, "namespace", NAMESPACE),
                new ClientCollaborators(
                        options -> Contract.withoutDocument(
                                options.endpoint().orElse(null), options.namespace().orElse(null), null),
                        createRequestBuilder(), transport, signatureVerifier));

        // When
        client.call("AnythingGoes");

        // Then: the call went out, introspection is refused
        assertSendCount(1);
        assertTrue(transport.lastRequest().body().contains("<tns:AnythingGoes>"));
        assertThrows(MissingContractException.class, client::operations);
        assertThrows(MissingContractException.class, client::serviceName);
    }

    @Test
    void testResolution_InsufficientOptions_FailsConstruction() {
        // When/Then
        InitializationException exception = assertThrows(InitializationException.class,
                () -> createClient(Map.of("endpoint", ENDPOINT), collaborators()));
        assertEquals(ErrorKind.INSUFFICIENT_CONFIGURATION, exception.kind());
        assertEquals(0, contractResolver.resolutionCount());
    }

    @Test
    void testResolution_UnknownOption_FailsConstruction() {
        // When/Then
        InitializationException exception = assertThrows(InitializationException.class,
                () -> newClient(Map.of("wsdl_cache", true)));
        assertTrue(exception.getMessage().contains("wsdl_cache"));
    }
}
