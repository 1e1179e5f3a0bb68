package com.ospicorp.tides.config;

import com.ospicorp.tides.tide.model.ConstituentCatalogue;
import com.ospicorp.tides.tide.service.CatalogueLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogueConfig {
  private static final Logger log = LoggerFactory.getLogger(CatalogueConfig.class);

  @Bean
  ConstituentCatalogue constituentCatalogue(
      @Value("${tides.catalogue.resource:constituents.csv}") String resource) {
    ConstituentCatalogue catalogue = CatalogueLoader.fromClasspath(resource);
    log.info("Loaded {} tidal constituents from {}", catalogue.size(), resource);
    return catalogue;
  }
}
