/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tracing;

/**
 * This allows configuration plugins to collaborate on building an instance of {@link
 * TaskTracing}. For example, one plugin can supply a shared {@code ObjectMapper}.
 */
public interface TaskTracingCustomizer {
  void customize(TaskTracing.Builder builder);
}
