package com.dronetrack.tracker.ingest;

/** What happened to one inbound message. */
public enum IngestResult {
  UPSERTED,
  CORRELATED,
  STATUS_PUBLISHED,
  INVALID_JSON,
  UNPARSEABLE,
  UNCORRELATED;

  public boolean accepted() {
    return this == UPSERTED || this == CORRELATED || this == STATUS_PUBLISHED;
  }
}
