package com.flamingo.ai.labmatch.service.embedding;

/** Selects the input framing applied before a text is encoded. */
public enum EmbeddingRole {
  /** Student-side text: research interests, statements, skills. */
  QUERY,

  /** Corpus-side text: lab descriptions and sections. */
  PASSAGE
}
