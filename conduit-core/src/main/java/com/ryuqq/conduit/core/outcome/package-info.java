/**
 * Lookup result contract package.
 *
 * <p>Sealed hierarchy that every batched or cached lookup is narrowed to at the boundary.</p>
 *
 * <h2>Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conduit.core.outcome.Found} - value present</li>
 *   <li>{@link com.ryuqq.conduit.core.outcome.Missing} - explicit not-found</li>
 *   <li>{@link com.ryuqq.conduit.core.outcome.Failed} - per-key error reported by the remote side</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conduit Team
 */
package com.ryuqq.conduit.core.outcome;
