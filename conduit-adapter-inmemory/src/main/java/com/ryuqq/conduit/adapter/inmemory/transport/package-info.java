/**
 * In-memory {@link com.ryuqq.conduit.core.spi.Transport} implementation (route table gateway).
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.adapter.inmemory.transport;
