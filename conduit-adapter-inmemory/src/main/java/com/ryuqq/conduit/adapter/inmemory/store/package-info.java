/**
 * In-memory {@link com.ryuqq.conduit.core.spi.CacheStore} implementation.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.adapter.inmemory.store;
