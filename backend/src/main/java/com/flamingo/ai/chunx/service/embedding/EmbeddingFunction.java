package com.flamingo.ai.chunx.service.embedding;

import java.util.List;

/**
 * Embedding capability used by semantic chunking.
 *
 * <p>Called once per chunking call with every context window; must return one equal-length vector
 * per input, in input order.
 */
@FunctionalInterface
public interface EmbeddingFunction {

  List<List<Float>> embed(List<String> texts);
}
