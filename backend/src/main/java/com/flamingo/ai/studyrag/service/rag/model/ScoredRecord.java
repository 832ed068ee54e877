package com.flamingo.ai.studyrag.service.rag.model;

/** A search hit: the stored record and its similarity to the query vector. */
public record ScoredRecord(VectorRecord record, double score) {}
