package com.flamingo.ai.studyrag.service.rag.model;

/**
 * Raw text handed to the ingestion pipeline by the document extraction step.
 *
 * @param sourceId identifier of the uploaded source (file, page, URL)
 * @param deckId deck the source belongs to
 * @param rawText extracted plain text
 */
public record SourceDocument(String sourceId, String deckId, String rawText) {}
