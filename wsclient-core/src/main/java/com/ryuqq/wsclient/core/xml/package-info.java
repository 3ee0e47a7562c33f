/**
 * Hardened DOM helpers shared by the adapters.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wsclient.core.xml;
