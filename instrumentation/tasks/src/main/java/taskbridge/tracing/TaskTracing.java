/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tracing;

import brave.Span;
import brave.Tracer;
import brave.Tracing;
import brave.internal.Nullable;
import brave.messaging.MessagingTracing;
import brave.propagation.CurrentTraceContext;
import brave.propagation.CurrentTraceContext.Scope;
import brave.propagation.Propagation;
import brave.propagation.TraceContext;
import brave.propagation.TraceContext.Extractor;
import brave.propagation.TraceContext.Injector;
import brave.propagation.TraceContextOrSamplingFlags;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import taskbridge.tasks.Chain;
import taskbridge.tasks.Chord;
import taskbridge.tasks.Group;
import taskbridge.tasks.Signature;

/**
 * Carries trace context through the headers of tasks sent to a broker, and tags spans with the
 * shape of the tasks they send.
 *
 * <p>The producer stamps its context before sending:
 * <pre>{@code
 * Span send = tracer.nextSpan().name("send_task").start();
 * signature.setHeaders(taskTracing.headersWithContext(signature.getHeaders(), send.context()));
 * taskTracing.annotateSpanWithSignatureInfo(send.context(), signature);
 * }</pre>
 *
 * <p>The worker continues it:
 * <pre>{@code
 * Span process = taskTracing.startSpanFromHeaders(signature.getHeaders(), signature.getName());
 * try (SpanInScope ws = tracer.withSpanInScope(process)) {
 *   ...
 * }}</pre>
 *
 * <p>None of these methods fail on bad input: malformed headers or a missing context only result
 * in less trace data.
 */
public final class TaskTracing {
  // Use nested class to ensure logger isn't initialized unless it is accessed once.
  private static final class LoggerHolder {
    static final Logger LOG = Logger.getLogger(TaskTracing.class.getName());
  }

  public static TaskTracing create(Tracing tracing) {
    return newBuilder(tracing).build();
  }

  public static TaskTracing create(MessagingTracing messagingTracing) {
    return newBuilder(messagingTracing).build();
  }

  public static Builder newBuilder(Tracing tracing) {
    if (tracing == null) throw new NullPointerException("tracing == null");
    return newBuilder(MessagingTracing.create(tracing));
  }

  public static Builder newBuilder(MessagingTracing messagingTracing) {
    return new Builder(messagingTracing);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    final MessagingTracing messagingTracing;
    ObjectMapper objectMapper;

    Builder(MessagingTracing messagingTracing) {
      if (messagingTracing == null) throw new NullPointerException("messagingTracing == null");
      this.messagingTracing = messagingTracing;
    }

    Builder(TaskTracing taskTracing) {
      this.messagingTracing = taskTracing.messagingTracing;
      this.objectMapper = taskTracing.objectMapper;
    }

    /**
     * Encodes the task UUIDs of a group into the {@link TaskTags#GROUP_TASKS} tag. Defaults to a
     * plain {@link ObjectMapper}.
     */
    public Builder objectMapper(ObjectMapper objectMapper) {
      if (objectMapper == null) throw new NullPointerException("objectMapper == null");
      this.objectMapper = objectMapper;
      return this;
    }

    public TaskTracing build() {
      return new TaskTracing(this);
    }
  }

  final MessagingTracing messagingTracing;
  final Tracer tracer;
  final CurrentTraceContext currentTraceContext;
  final Injector<Map<String, String>> injector;
  final Extractor<Map<String, String>> extractor;
  final ObjectMapper objectMapper;
  final TaskSpanAnnotator annotator;

  TaskTracing(Builder builder) { // intentionally hidden constructor
    this.messagingTracing = builder.messagingTracing;
    Tracing tracing = messagingTracing.tracing();
    this.tracer = tracing.tracer();
    this.currentTraceContext = tracing.currentTraceContext();
    Propagation<String> propagation = messagingTracing.propagation();
    this.injector = propagation.injector(TaskHeaders.SETTER);
    this.extractor = propagation.extractor(TaskHeaders.GETTER);
    this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    this.annotator = new TaskSpanAnnotator(this);
  }

  public MessagingTracing messagingTracing() {
    return messagingTracing;
  }

  /**
   * Starts a span named {@code operationName} that continues the trace in the headers, or a new
   * trace when the headers hold none. The span in scope, if any, is not used as a parent: only
   * the headers decide.
   *
   * <p>The result's {@link Span#context() context} is the one to stamp onto tasks sent while
   * processing. The headers are not modified.
   */
  public Span startSpanFromHeaders(@Nullable Map<String, ?> headers, String operationName) {
    TraceContextOrSamplingFlags extracted = constructContextFromHeaders(headers);
    Span span;
    // Clear the current scope, otherwise a missing parent in the headers would join it
    try (Scope scope = currentTraceContext.newScope(null)) {
      span = tracer.nextSpan(extracted);
    }
    if (operationName != null) span.name(operationName);
    return span.start();
  }

  /**
   * Decodes the trace context in the headers without starting a span. Headers that aren't strings
   * are ignored. The result is {@link TraceContextOrSamplingFlags#context() empty} when no valid
   * trace context was present.
   */
  public TraceContextOrSamplingFlags constructContextFromHeaders(@Nullable Map<String, ?> headers) {
    return extractor.extract(TaskHeaders.toCarrier(headers));
  }

  /**
   * Writes the context into the headers, overwriting the fields it injects and leaving every other
   * header alone. Writing the same context again produces the same headers.
   *
   * @param headers possibly {@code null}, in which case a new map is allocated
   * @param context when {@code null}, the headers are returned unchanged
   * @return the headers written to, which the caller must keep in place of its input
   */
  public Map<String, Object> headersWithContext(
    @Nullable Map<String, Object> headers, @Nullable TraceContext context) {
    if (context == null) return headers;
    Map<String, String> carrier = new LinkedHashMap<>();
    injector.inject(context, carrier);
    return TaskHeaders.fromCarrier(carrier, headers);
  }

  /**
   * Tags the span of the context with the task name and UUID, its group UUID if it is in a group,
   * and its chord callback if it has one.
   */
  public void annotateSpanWithSignatureInfo(
    @Nullable TraceContext context, @Nullable Signature signature) {
    annotator.annotateSignature(context, signature);
  }

  /** Tags the chain length and stamps the context onto each task of the chain. */
  public void annotateSpanWithChainInfo(@Nullable TraceContext context, @Nullable Chain chain) {
    annotator.annotateChain(context, chain);
  }

  /**
   * Tags the group UUID, size, send concurrency and member UUIDs, and stamps the context onto each
   * task of the group.
   *
   * @param concurrency how many tasks of the group are sent at a time
   */
  public void annotateSpanWithGroupInfo(
    @Nullable TraceContext context, @Nullable Group group, int concurrency) {
    annotator.annotateGroup(context, group, concurrency);
  }

  /**
   * Tags the callback UUID and stamps the context onto the callback, then does the same as {@link
   * #annotateSpanWithGroupInfo} for the group.
   */
  public void annotateSpanWithChordInfo(
    @Nullable TraceContext context, @Nullable Chord chord, int concurrency) {
    annotator.annotateChord(context, chord, concurrency);
  }

  @Override public String toString() {
    return "TaskTracing{messagingTracing=" + messagingTracing + "}";
  }

  /**
   * Avoids array allocation when logging a parameterized message when fine level is disabled. The
   * second parameter is optional.
   *
   * <p>Ex.
   * <pre>{@code
   * try {
   *    encoded = objectMapper.writeValueAsString(uuids);
   *  } catch (JsonProcessingException e) {
   *    log(e, "error encoding task uuids of group {0}", groupUuid, null);
   *  }
   * }</pre>
   */
  static void log(Throwable thrown, String msg, Object zero, @Nullable Object one) {
    Logger logger = LoggerHolder.LOG;
    if (!logger.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LogRecord lr = new LogRecord(Level.FINE, msg);
    Object[] params = one != null ? new Object[] {zero, one} : new Object[] {zero};
    lr.setParameters(params);
    lr.setThrown(thrown);
    logger.log(lr);
  }
}
