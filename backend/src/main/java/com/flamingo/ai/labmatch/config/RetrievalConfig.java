package com.flamingo.ai.labmatch.config;

import com.flamingo.ai.labmatch.service.retrieval.DomainTaxonomy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetrievalConfig {

  @Bean
  public DomainTaxonomy domainTaxonomy() {
    return DomainTaxonomy.defaults();
  }
}
