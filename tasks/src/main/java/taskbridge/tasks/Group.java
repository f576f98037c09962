/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tasks;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Tasks executed in parallel, sharing a group UUID. */
public final class Group {
  /**
   * Allocates a group UUID and stamps it on every task, assigning task UUIDs to any task that has
   * none yet.
   */
  public static Group create(Signature... tasks) {
    if (tasks == null) throw new NullPointerException("tasks == null");
    String groupUuid = TaskIds.newGroupId();
    for (Signature task : tasks) {
      if (TaskIds.isEmpty(task.getUuid())) task.setUuid(TaskIds.newTaskId());
      task.setGroupUuid(groupUuid);
      task.setGroupTaskCount(tasks.length);
    }
    return new Group(groupUuid, new ArrayList<>(Arrays.asList(tasks)));
  }

  /** Wraps tasks whose group fields were already assigned, for example by a remote producer. */
  public static Group of(String groupUuid, List<Signature> tasks) {
    if (tasks == null) throw new NullPointerException("tasks == null");
    return new Group(groupUuid, new ArrayList<>(tasks));
  }

  final String groupUuid;
  final List<Signature> tasks;

  Group(String groupUuid, List<Signature> tasks) {
    this.groupUuid = groupUuid;
    this.tasks = Collections.unmodifiableList(tasks);
  }

  public String groupUuid() {
    return groupUuid;
  }

  public List<Signature> tasks() {
    return tasks;
  }

  /** Returns the UUID of each task, in task order. */
  public List<String> uuids() {
    List<String> result = new ArrayList<>(tasks.size());
    for (Signature task : tasks) result.add(task.getUuid());
    return result;
  }

  @Override public String toString() {
    return "Group{groupUuid=" + groupUuid + ", tasks=" + tasks + "}";
  }
}
