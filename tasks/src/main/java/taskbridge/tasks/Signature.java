/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tasks;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Describes a single task to dispatch: its identity, where it fits in a composition, and the
 * headers that travel with it through the broker.
 *
 * <p>Header values are untyped. Strings survive every broker, while numbers, booleans or nested
 * structures depend on how the broker serializes the signature.
 */
public class Signature {
  String uuid;
  String name;
  String routingKey;
  String groupUuid;
  int groupTaskCount;
  Map<String, Object> headers;
  boolean immutable;
  int retryCount;
  List<Signature> onSuccess;
  List<Signature> onError;
  Signature chordCallback;

  public static Signature create(String name) {
    Signature result = new Signature();
    result.setName(name);
    result.setUuid(TaskIds.newTaskId());
    return result;
  }

  public String getUuid() {
    return uuid;
  }

  public void setUuid(String uuid) {
    this.uuid = uuid;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getRoutingKey() {
    return routingKey;
  }

  public void setRoutingKey(String routingKey) {
    this.routingKey = routingKey;
  }

  /** Empty or {@code null} unless this task is a member of a {@link Group}. */
  public String getGroupUuid() {
    return groupUuid;
  }

  public void setGroupUuid(String groupUuid) {
    this.groupUuid = groupUuid;
  }

  public int getGroupTaskCount() {
    return groupTaskCount;
  }

  public void setGroupTaskCount(int groupTaskCount) {
    this.groupTaskCount = groupTaskCount;
  }

  /** Possibly {@code null} when nothing has been attached yet. */
  public Map<String, Object> getHeaders() {
    return headers;
  }

  public void setHeaders(Map<String, Object> headers) {
    this.headers = headers;
  }

  public boolean isImmutable() {
    return immutable;
  }

  public void setImmutable(boolean immutable) {
    this.immutable = immutable;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public void setRetryCount(int retryCount) {
    this.retryCount = retryCount;
  }

  public List<Signature> getOnSuccess() {
    return onSuccess;
  }

  public void setOnSuccess(List<Signature> onSuccess) {
    this.onSuccess = onSuccess;
  }

  public List<Signature> getOnError() {
    return onError;
  }

  public void setOnError(List<Signature> onError) {
    this.onError = onError;
  }

  /** The task run once every member of this task's group completes, or {@code null}. */
  public Signature getChordCallback() {
    return chordCallback;
  }

  public void setChordCallback(Signature chordCallback) {
    this.chordCallback = chordCallback;
  }

  void addOnSuccess(Signature next) {
    if (onSuccess == null) onSuccess = new ArrayList<>();
    onSuccess.add(next);
  }

  @Override public String toString() {
    return "Signature{name=" + name + ", uuid=" + uuid + "}";
  }
}
