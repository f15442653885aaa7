package com.rolefit.matcher.semantic;

import com.rolefit.matcher.document.Chunk;

/**
 * A candidate chunk and its raw cosine similarity to the role.
 */
public record ChunkMatch(Chunk chunk, double similarity) {}
