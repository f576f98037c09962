/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tracing;

import brave.baggage.BaggageField;
import brave.baggage.BaggagePropagation;
import brave.baggage.BaggagePropagationConfig.SingleBaggageField;
import brave.propagation.Propagation;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import taskbridge.propagation.w3c.TraceContextPropagation;

/**
 * Builds the propagation format written to task headers: trace identity in W3C trace-context
 * fields, plus one field per baggage entry, named with the prefix {@value #BAGGAGE_PREFIX}.
 *
 * <p>Build this once and pass it to {@link brave.Tracing.Builder#propagationFactory}. Ex.
 * <pre>{@code
 * BaggageField tenant = BaggageField.create("tenant");
 * Tracing tracing = Tracing.newBuilder()
 *   .propagationFactory(TaskPropagation.newFactoryBuilder().addBaggageField(tenant).build())
 *   ...
 *   .build();
 * TaskTracing taskTracing = TaskTracing.create(tracing);
 * }</pre>
 */
public final class TaskPropagation {
  public static final String BAGGAGE_PREFIX = "baggage-";

  /** Trace identity only, without baggage fields. */
  public static Propagation.Factory create() {
    return newFactoryBuilder().build();
  }

  public static FactoryBuilder newFactoryBuilder() {
    return new FactoryBuilder();
  }

  public static final class FactoryBuilder {
    Propagation.Factory identity = TraceContextPropagation.create();
    final List<SingleBaggageField> baggageFields = new ArrayList<>();

    /**
     * Overrides the format of trace identifiers. Defaults to {@link TraceContextPropagation}.
     *
     * <p>The format must not carry baggage itself.
     */
    public FactoryBuilder identity(Propagation.Factory identity) {
      if (identity == null) throw new NullPointerException("identity == null");
      this.identity = identity;
      return this;
    }

    /**
     * Propagates the field under the key {@value TaskPropagation#BAGGAGE_PREFIX} plus its
     * lowercase name.
     */
    public FactoryBuilder addBaggageField(BaggageField field) {
      if (field == null) throw new NullPointerException("field == null");
      return addBaggageField(field, BAGGAGE_PREFIX + field.name().toLowerCase(Locale.ROOT));
    }

    /** Propagates the field under the given keys. Each key is written, and any one is read. */
    public FactoryBuilder addBaggageField(BaggageField field, String... keyNames) {
      if (field == null) throw new NullPointerException("field == null");
      if (keyNames == null || keyNames.length == 0) {
        throw new IllegalArgumentException("keyNames are empty");
      }
      SingleBaggageField.Builder builder = SingleBaggageField.newBuilder(field);
      for (String keyName : keyNames) builder.addKeyName(keyName);
      baggageFields.add(builder.build());
      return this;
    }

    /**
     * @throws IllegalArgumentException if a baggage key is also used for trace identity
     */
    public Propagation.Factory build() {
      if (baggageFields.isEmpty()) return identity;

      Set<String> identityKeys = new LinkedHashSet<>(identity.get().keys());
      BaggagePropagation.FactoryBuilder builder = BaggagePropagation.newFactoryBuilder(identity);
      for (SingleBaggageField config : baggageFields) {
        for (String keyName : config.keyNames()) {
          if (identityKeys.contains(keyName)) {
            throw new IllegalArgumentException(
              "Baggage key " + keyName + " collides with a trace identity key");
          }
        }
        builder.add(config);
      }
      return builder.build();
    }

    FactoryBuilder() {
    }
  }

  TaskPropagation() {
  }
}
