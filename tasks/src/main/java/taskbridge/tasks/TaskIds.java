/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tasks;

import java.util.UUID;

final class TaskIds {
  static String newTaskId() {
    return "task_" + UUID.randomUUID();
  }

  static String newGroupId() {
    return "group_" + UUID.randomUUID();
  }

  static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }

  TaskIds() {
  }
}
