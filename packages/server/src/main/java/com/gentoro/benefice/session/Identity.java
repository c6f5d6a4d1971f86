package com.gentoro.benefice.session;

import java.util.Objects;

/** An authenticated user as seen by the job server: a stable id and the quota tier. */
public record Identity(String uid, boolean starred) {
  public Identity {
    Objects.requireNonNull(uid, "uid");
  }
}
