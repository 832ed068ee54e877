package com.flamingo.ai.studyrag.service.ingestion;

import java.util.List;

/** Summary of an ingestion batch, one entry per source in submission order. */
public record IngestionReport(List<SourceIngestionResult> sources) {

  public IngestionReport {
    sources = List.copyOf(sources);
  }

  public int totalBlocks() {
    return sources.stream().mapToInt(SourceIngestionResult::blocks).sum();
  }

  public int embeddedBlocks() {
    return sources.stream().mapToInt(SourceIngestionResult::embedded).sum();
  }

  public int failedBlocks() {
    return sources.stream().mapToInt(SourceIngestionResult::failed).sum();
  }

  public long completeSources() {
    return sources.stream().filter(SourceIngestionResult::isComplete).count();
  }
}
