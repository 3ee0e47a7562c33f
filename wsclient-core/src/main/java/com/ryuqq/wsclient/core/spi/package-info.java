/**
 * Service Provider Interfaces for the client collaborators.
 *
 * <p>The invocation controller depends only on these ports. Default implementations live in the
 * adapter modules:</p>
 * <ul>
 *   <li>{@link com.ryuqq.wsclient.core.spi.ContractResolver}, {@link com.ryuqq.wsclient.core.spi.DocumentLoader},
 *       {@link com.ryuqq.wsclient.core.spi.RequestBuilder} - wsclient-adapter-wsdl</li>
 *   <li>{@link com.ryuqq.wsclient.core.spi.Transport} - wsclient-adapter-http</li>
 *   <li>{@link com.ryuqq.wsclient.core.spi.SignatureVerifier} - wsclient-adapter-wsse</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.core.spi;
