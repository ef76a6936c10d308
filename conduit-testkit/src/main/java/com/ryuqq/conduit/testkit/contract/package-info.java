/**
 * Contract test kit: base class and in-memory helpers for verifying an orchestrator setup.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.testkit.contract;
