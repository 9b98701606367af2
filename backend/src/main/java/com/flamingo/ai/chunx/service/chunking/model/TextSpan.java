package com.flamingo.ai.chunx.service.chunking.model;

/**
 * Read-only view shared by {@link Chunk} and {@link SentenceChunk}: a piece of source text with
 * its half-open UTF-8 byte span and token count.
 */
public interface TextSpan {

  String text();

  int startByte();

  int endByte();

  int tokenCount();
}
