package com.flamingo.ai.labmatch.service.corpus;

import com.flamingo.ai.labmatch.domain.model.CorpusEntity;
import java.io.IOException;
import java.util.List;

/** Read-only access to the external document store holding lab profiles. */
public interface CorpusSource {

  /**
   * Lists every lab profile in the store.
   *
   * @return entities in a stable order
   * @throws IOException if the store cannot be read
   */
  List<CorpusEntity> listEntities() throws IOException;

  /** Human-readable location of the store, for logs. */
  String describe();
}
