/**
 * Client configuration.
 *
 * <p>{@link com.ryuqq.wsclient.core.config.ClientOptions} is immutable and validated once when a client
 * is created. {@link com.ryuqq.wsclient.core.config.HttpSettings} and
 * {@link com.ryuqq.wsclient.core.config.WsseSettings} are the mutable transport state: the client owns
 * one of each and hands independent copies to every prepared request.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.core.config;
