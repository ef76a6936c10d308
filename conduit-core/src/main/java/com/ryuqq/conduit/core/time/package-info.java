/**
 * 시각 공급자 패키지.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.core.time;
