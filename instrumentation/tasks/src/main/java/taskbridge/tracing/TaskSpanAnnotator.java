/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tracing;

import brave.NoopSpanCustomizer;
import brave.SpanCustomizer;
import brave.Tracer;
import brave.internal.Nullable;
import brave.propagation.TraceContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import taskbridge.tasks.Chain;
import taskbridge.tasks.Chord;
import taskbridge.tasks.Group;
import taskbridge.tasks.Signature;

import static taskbridge.tracing.TaskTags.CHAIN_TASKS_LENGTH;
import static taskbridge.tracing.TaskTags.CHORD_CALLBACK_UUID;
import static taskbridge.tracing.TaskTags.GROUP_CONCURRENCY;
import static taskbridge.tracing.TaskTags.GROUP_TASKS;
import static taskbridge.tracing.TaskTags.GROUP_TASKS_LENGTH;
import static taskbridge.tracing.TaskTags.GROUP_UUID;
import static taskbridge.tracing.TaskTags.SIGNATURE_CHORD_CALLBACK_NAME;
import static taskbridge.tracing.TaskTags.SIGNATURE_CHORD_CALLBACK_UUID;
import static taskbridge.tracing.TaskTags.SIGNATURE_GROUP_UUID;
import static taskbridge.tracing.TaskTags.SIGNATURE_NAME;
import static taskbridge.tracing.TaskTags.SIGNATURE_UUID;
import static taskbridge.tracing.TaskTracing.log;

/**
 * Tags the span of a context with the shape of the task graph being sent, and stamps that same
 * context onto every nested task. Members of a chain, group or chord become siblings under the
 * sending span, never children of each other.
 */
final class TaskSpanAnnotator {
  final TaskTracing taskTracing;
  final Tracer tracer;
  final ObjectMapper objectMapper;

  TaskSpanAnnotator(TaskTracing taskTracing) {
    this.taskTracing = taskTracing;
    this.tracer = taskTracing.tracer;
    this.objectMapper = taskTracing.objectMapper;
  }

  void annotateSignature(@Nullable TraceContext context, @Nullable Signature signature) {
    if (signature == null) return;
    SpanCustomizer span = spanOf(context);

    tag(span, SIGNATURE_NAME, signature.getName());
    tag(span, SIGNATURE_UUID, signature.getUuid());
    String groupUuid = signature.getGroupUuid();
    if (groupUuid != null && !groupUuid.isEmpty()) span.tag(SIGNATURE_GROUP_UUID, groupUuid);

    Signature callback = signature.getChordCallback();
    if (callback != null) {
      tag(span, SIGNATURE_CHORD_CALLBACK_UUID, callback.getUuid());
      tag(span, SIGNATURE_CHORD_CALLBACK_NAME, callback.getName());
    }
  }

  void annotateChain(@Nullable TraceContext context, @Nullable Chain chain) {
    if (chain == null) return;
    SpanCustomizer span = spanOf(context);

    span.tag(CHAIN_TASKS_LENGTH, String.valueOf(chain.tasks().size()));
    stampAll(context, chain.tasks());
  }

  void annotateGroup(@Nullable TraceContext context, @Nullable Group group, int concurrency) {
    if (group == null) return;
    SpanCustomizer span = spanOf(context);

    tag(span, GROUP_UUID, group.groupUuid());
    span.tag(GROUP_TASKS_LENGTH, String.valueOf(group.tasks().size()));
    span.tag(GROUP_CONCURRENCY, String.valueOf(concurrency));
    tagGroupTasks(span, group);
    stampAll(context, group.tasks());
  }

  void annotateChord(@Nullable TraceContext context, @Nullable Chord chord, int concurrency) {
    if (chord == null) return;
    SpanCustomizer span = spanOf(context);

    Signature callback = chord.callback();
    if (callback != null) {
      tag(span, CHORD_CALLBACK_UUID, callback.getUuid());
      stamp(context, callback);
    }
    annotateGroup(context, chord.group(), concurrency);
  }

  /** Encoding errors fall back to a comma-separated list. */
  void tagGroupTasks(SpanCustomizer span, Group group) {
    List<String> uuids = group.uuids();
    String encoded;
    try {
      encoded = objectMapper.writeValueAsString(uuids);
    } catch (JsonProcessingException e) {
      log(e, "error encoding task uuids of group {0}", group.groupUuid(), null);
      encoded = joinUuids(uuids);
    }
    span.tag(GROUP_TASKS, encoded);
  }

  void stampAll(@Nullable TraceContext context, List<Signature> tasks) {
    for (Signature task : tasks) stamp(context, task);
  }

  void stamp(@Nullable TraceContext context, Signature task) {
    task.setHeaders(taskTracing.headersWithContext(task.getHeaders(), context));
  }

  /** Returns a noop customizer when there's no context or it isn't recorded. */
  SpanCustomizer spanOf(@Nullable TraceContext context) {
    if (context == null) return NoopSpanCustomizer.INSTANCE;
    return tracer.toSpan(context);
  }

  /** Empty values are tagged as-is. Brave rejects null ones. */
  static void tag(SpanCustomizer span, String key, @Nullable String value) {
    if (value != null) span.tag(key, value);
  }

  static String joinUuids(List<String> uuids) {
    StringBuilder result = new StringBuilder();
    for (int i = 0, length = uuids.size(); i < length; i++) {
      if (i > 0) result.append(',');
      result.append(uuids.get(i));
    }
    return result.toString();
  }
}
