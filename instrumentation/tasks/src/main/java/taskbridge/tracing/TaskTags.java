/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tracing;

/** Tag keys added to spans that send or process tasks. */
public final class TaskTags {
  public static final String
    SIGNATURE_NAME = "signature.name",
    SIGNATURE_UUID = "signature.uuid",
    SIGNATURE_GROUP_UUID = "signature.group.uuid",
    SIGNATURE_CHORD_CALLBACK_UUID = "signature.chord.callback.uuid",
    SIGNATURE_CHORD_CALLBACK_NAME = "signature.chord.callback.name",
    CHAIN_TASKS_LENGTH = "chain.tasks.length",
    GROUP_UUID = "group.uuid",
    GROUP_TASKS_LENGTH = "group.tasks.length",
    GROUP_CONCURRENCY = "group.concurrency",
    /** A JSON array of member task UUIDs, or a comma-separated list if that couldn't be encoded */
    GROUP_TASKS = "group.tasks",
    CHORD_CALLBACK_UUID = "chord.callback.uuid";

  TaskTags() {
  }
}
