/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tasks;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Tasks executed one after another, each started by the success of the previous. */
public final class Chain {
  /**
   * Links each task to the next through {@link Signature#getOnSuccess()}. The first task is the one
   * sent to the broker.
   */
  public static Chain create(Signature... tasks) {
    if (tasks == null) throw new NullPointerException("tasks == null");
    List<Signature> list = new ArrayList<>(Arrays.asList(tasks));
    for (int i = list.size() - 1; i > 0; i--) {
      list.get(i - 1).addOnSuccess(list.get(i));
    }
    return new Chain(list);
  }

  final List<Signature> tasks;

  Chain(List<Signature> tasks) {
    this.tasks = Collections.unmodifiableList(tasks);
  }

  public List<Signature> tasks() {
    return tasks;
  }

  @Override public String toString() {
    return "Chain{tasks=" + tasks + "}";
  }
}
