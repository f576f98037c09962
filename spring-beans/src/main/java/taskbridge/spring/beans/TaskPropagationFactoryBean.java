/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.spring.beans;

import brave.baggage.BaggageField;
import brave.propagation.Propagation;
import java.util.List;
import org.springframework.beans.factory.FactoryBean;
import taskbridge.tracing.TaskPropagation;

/** Spring XML config does not support chained builders. This converts accordingly */
public class TaskPropagationFactoryBean implements FactoryBean<Propagation.Factory> {
  Propagation.Factory identity;
  List<BaggageField> baggageFields;

  @Override public Propagation.Factory getObject() {
    TaskPropagation.FactoryBuilder builder = TaskPropagation.newFactoryBuilder();
    if (identity != null) builder.identity(identity);
    if (baggageFields != null) {
      for (BaggageField field : baggageFields) builder.addBaggageField(field);
    }
    return builder.build();
  }

  @Override public Class<? extends Propagation.Factory> getObjectType() {
    return Propagation.Factory.class;
  }

  @Override public boolean isSingleton() {
    return true;
  }

  public void setIdentity(Propagation.Factory identity) {
    this.identity = identity;
  }

  public void setBaggageFields(List<BaggageField> baggageFields) {
    this.baggageFields = baggageFields;
  }
}
