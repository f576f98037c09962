/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.spring.beans;

import brave.Tracing;
import brave.messaging.MessagingTracing;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.springframework.beans.factory.FactoryBean;
import taskbridge.tracing.TaskTracing;
import taskbridge.tracing.TaskTracingCustomizer;

/**
 * Spring XML config does not support chained builders. This converts accordingly.
 *
 * <p>Set either {@code messagingTracing} or {@code tracing}. When both are set, {@code
 * messagingTracing} wins.
 */
public class TaskTracingFactoryBean implements FactoryBean<TaskTracing> {
  Tracing tracing;
  MessagingTracing messagingTracing;
  ObjectMapper objectMapper;
  List<TaskTracingCustomizer> customizers;

  @Override public TaskTracing getObject() {
    TaskTracing.Builder builder = messagingTracing != null
      ? TaskTracing.newBuilder(messagingTracing)
      : TaskTracing.newBuilder(tracing);
    if (objectMapper != null) builder.objectMapper(objectMapper);
    if (customizers != null) {
      for (TaskTracingCustomizer customizer : customizers) customizer.customize(builder);
    }
    return builder.build();
  }

  @Override public Class<? extends TaskTracing> getObjectType() {
    return TaskTracing.class;
  }

  @Override public boolean isSingleton() {
    return true;
  }

  public void setTracing(Tracing tracing) {
    this.tracing = tracing;
  }

  public void setMessagingTracing(MessagingTracing messagingTracing) {
    this.messagingTracing = messagingTracing;
  }

  public void setObjectMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public void setCustomizers(List<TaskTracingCustomizer> customizers) {
    this.customizers = customizers;
  }
}
