package com.trendlens.api.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendlens.engine.config.EngineConfig;
import com.trendlens.engine.error.ValidationException;
import com.trendlens.engine.model.SnapshotSet;
import com.trendlens.engine.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

/**
 * Appends snapshot sets published by the crawler. Malformed, invalid and duplicate sets are logged and
 * dropped; a redelivered tick is already stored and must not be retried.
 */
@Component
@Profile("kafka-ingest")
public class SnapshotSetConsumer {

  private static final Logger log = LoggerFactory.getLogger(SnapshotSetConsumer.class);

  private final SnapshotStore store;
  private final ObjectMapper mapper = EngineConfig.snapshotMapper();

  public SnapshotSetConsumer(SnapshotStore store) {
    this.store = store;
  }

  @KafkaListener(
    topics = "${trendlens.kafka.topics.snapshots}",
    concurrency = "${trendlens.kafka.concurrency:1}"
  )
  public void onMessage(
      String payload,
      @Header(name = KafkaHeaders.RECEIVED_PARTITION, required = false) Integer partition,
      @Header(name = KafkaHeaders.OFFSET, required = false) Long offset) {

    SnapshotSet set;
    try {
      set = mapper.readValue(payload, SnapshotSet.class);
    } catch (JsonProcessingException e) {
      log.warn("Dropping unparseable snapshot set at partition={} offset={}: {}", partition, offset, e.getOriginalMessage());
      return;
    }
    if (set == null) {
      log.warn("Dropping empty snapshot set at partition={} offset={}", partition, offset);
      return;
    }
    try {
      store.append(set);
    } catch (ValidationException e) {
      log.warn("Dropping snapshot set {} at partition={} offset={}: {}", set.capturedAt(), partition, offset, e.getMessage());
      return;
    }
    log.debug("Appended tick {} from partition={} offset={}", set.capturedAt(), partition, offset);
  }
}
