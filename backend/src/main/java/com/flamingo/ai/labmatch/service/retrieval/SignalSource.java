package com.flamingo.ai.labmatch.service.retrieval;

/** Which stage-1 signals contributed to a candidate's combined score. */
public enum SignalSource {
  LEXICAL,
  SEMANTIC,
  DOMAIN,

  /** The domain score replaced a weaker lexical score. */
  DOMAIN_SUBSTITUTED
}
