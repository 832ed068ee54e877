package com.flamingo.ai.studyrag.service.rag.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studyrag.service.rag.model.VectorRecord;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only JSON-lines journal backing {@link LocalVectorIndex}.
 *
 * <p>The first line records the embedding profile the index was built with; following lines are
 * upserts and deletes replayed in order on startup. One appending writer stays open for the life
 * of the index.
 */
@Slf4j
class VectorRecordJournal {

  static final String OP_PROFILE = "profile";
  static final String OP_UPSERT = "upsert";
  static final String OP_DELETE = "delete";

  private final Path path;
  private final ObjectMapper objectMapper;
  private BufferedWriter writer;

  VectorRecordJournal(Path path, ObjectMapper objectMapper) {
    this.path = path;
    this.objectMapper = objectMapper;
  }

  Path path() {
    return path;
  }

  boolean exists() {
    return Files.exists(path);
  }

  /**
   * Replays every entry in file order.
   *
   * @return number of entries read
   */
  long replay(Consumer<Entry> consumer) throws IOException {
    long lines = 0;
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        consumer.accept(objectMapper.readValue(line, Entry.class));
        lines++;
      }
    }
    log.debug("Replayed {} journal entries from {}", lines, path);
    return lines;
  }

  /** Appends an entry to the open writer. Entries reach the file on {@link #flush()}. */
  synchronized void append(Entry entry) throws IOException {
    if (writer == null) {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      writer =
          Files.newBufferedWriter(
              path,
              StandardCharsets.UTF_8,
              StandardOpenOption.CREATE,
              StandardOpenOption.WRITE,
              StandardOpenOption.APPEND);
    }
    writer.write(objectMapper.writeValueAsString(entry));
    writer.newLine();
  }

  synchronized void flush() throws IOException {
    if (writer != null) {
      writer.flush();
    }
  }

  synchronized void close() throws IOException {
    if (writer != null) {
      try {
        writer.close();
      } finally {
        writer = null;
      }
    }
  }

  /** One journal line. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  record Entry(
      String op,
      String profile,
      String id,
      String deckId,
      float[] vector,
      String text,
      String sourceId,
      Integer position,
      Integer tokenCount) {

    static Entry profile(String profile) {
      return new Entry(OP_PROFILE, profile, null, null, null, null, null, null, null);
    }

    static Entry upsert(VectorRecord record) {
      VectorRecord.Payload payload = record.payload();
      return new Entry(
          OP_UPSERT,
          null,
          record.id(),
          record.deckId(),
          record.vector(),
          payload.text(),
          payload.sourceId(),
          payload.position(),
          payload.tokenCount());
    }

    static Entry delete(String id) {
      return new Entry(OP_DELETE, null, id, null, null, null, null, null, null);
    }

    VectorRecord toRecord() {
      return new VectorRecord(
          id,
          deckId,
          vector,
          new VectorRecord.Payload(
              text,
              sourceId,
              position == null ? 0 : position,
              tokenCount == null ? 0 : tokenCount));
    }
  }
}
