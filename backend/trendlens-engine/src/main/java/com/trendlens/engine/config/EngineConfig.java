package com.trendlens.engine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trendlens.engine.store.FileSnapshotStore;
import com.trendlens.engine.store.SnapshotStore;
import com.trendlens.engine.text.CapitalizedEntityExtractor;
import com.trendlens.engine.text.EntityExtractor;
import com.trendlens.engine.text.Stopwords;
import com.trendlens.engine.text.Tokenizer;
import com.trendlens.engine.time.DateQueryParser;
import com.trendlens.engine.time.DateRanges;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({EngineSettings.class, StoreProperties.class})
public class EngineConfig {

  private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

  static final int MIN_TOKEN_LENGTH = 2;
  static final int MAX_TOKEN_LENGTH = 40;

  @Bean
  public Clock clock(EngineSettings settings) {
    return Clock.system(settings.zoneId());
  }

  @Bean
  public Tokenizer tokenizer(EngineSettings settings) {
    Stopwords stopwords = Stopwords.load(Optional.of(Stopwords.DEFAULT_RESOURCE), settings.extraStopwords());
    log.info("Loaded {} stopwords ({} configured extras)", stopwords.size(), settings.extraStopwords().size());
    return new Tokenizer(stopwords, MIN_TOKEN_LENGTH, MAX_TOKEN_LENGTH);
  }

  @Bean
  @ConditionalOnProperty(name = "trendlens.engine.entity-extraction-enabled", havingValue = "true", matchIfMissing = true)
  public EntityExtractor entityExtractor(Tokenizer tokenizer) {
    return new CapitalizedEntityExtractor(tokenizer);
  }

  @Bean
  public DateRanges dateRanges(Clock clock, EngineSettings settings) {
    return new DateRanges(clock, settings);
  }

  @Bean
  public DateQueryParser dateQueryParser(Clock clock) {
    return new DateQueryParser(clock);
  }

  @Bean
  public SnapshotStore snapshotStore(StoreProperties store, EngineSettings settings, MeterRegistry metrics) {
    log.info("Snapshot store at {} (zone {})", store.rootPath().toAbsolutePath(), settings.zoneId());
    return new FileSnapshotStore(store.rootPath(), snapshotMapper(), settings.zoneId(), settings.captureJitter(), metrics);
  }

  /** Mapper for tick documents. Not registered as a bean. */
  public static ObjectMapper snapshotMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }
}
