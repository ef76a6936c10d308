/**
 * HTTP Adapter - JDK HttpClient Transport와 JSON 다중 조회 변환기.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.adapter.http;
