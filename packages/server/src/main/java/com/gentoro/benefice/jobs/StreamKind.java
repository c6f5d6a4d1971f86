package com.gentoro.benefice.jobs;

/** Which of a workload's captured output streams to read. */
public enum StreamKind {
  OUTPUT,
  ERROR
}
