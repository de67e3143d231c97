package org.wordscope.ingestion.model;

public record IngestRequest(String content) {
}
