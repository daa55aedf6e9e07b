package com.scholary.transcriber.job;

/** Queue tiers, most urgent first. Tasks within a tier run in arrival order. */
public enum TaskPriority {
  URGENT,
  HIGH,
  NORMAL,
  LOW
}
