/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tasks;

/** A {@link Group} whose completion triggers a callback task. */
public final class Chord {
  /** Attaches the callback to every task in the group. */
  public static Chord create(Group group, Signature callback) {
    if (group == null) throw new NullPointerException("group == null");
    if (callback == null) throw new NullPointerException("callback == null");
    for (Signature task : group.tasks()) {
      task.setChordCallback(callback);
    }
    return new Chord(group, callback);
  }

  final Group group;
  final Signature callback;

  Chord(Group group, Signature callback) {
    this.group = group;
    this.callback = callback;
  }

  public Group group() {
    return group;
  }

  public Signature callback() {
    return callback;
  }

  @Override public String toString() {
    return "Chord{group=" + group + ", callback=" + callback + "}";
  }
}
