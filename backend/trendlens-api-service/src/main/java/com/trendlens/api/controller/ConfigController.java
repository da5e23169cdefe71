package com.trendlens.api.controller;

import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.config.StoreProperties;
import com.trendlens.engine.error.ValidationException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {

  private final EngineSettings settings;
  private final StoreProperties store;

  public ConfigController(EngineSettings settings, StoreProperties store) {
    this.settings = settings;
    this.store = store;
  }

  @GetMapping("/api/config")
  public Map<String, Object> config(@RequestParam(name = "section", defaultValue = "all") String section) {
    Map<String, Object> out = new LinkedHashMap<>();
    switch (section.strip().toLowerCase(Locale.ROOT)) {
      case "all" -> {
        out.put("engine", settings);
        out.put("store", storeSection());
      }
      case "keywords" -> out.put("keywords", Map.of("watchKeywords", settings.watchKeywords()));
      case "weights" -> out.put("weights", weightsSection());
      case "store" -> out.put("store", storeSection());
      default -> throw new ValidationException(
          "Unknown config section '" + section + "', expected all, keywords, weights or store");
    }
    return out;
  }

  private Map<String, Object> weightsSection() {
    Map<String, Object> weights = new LinkedHashMap<>();
    weights.put("rankWeight", settings.rankWeight());
    weights.put("frequencyWeight", settings.frequencyWeight());
    weights.put("hotnessWeight", settings.hotnessWeight());
    weights.put("rankScale", settings.rankScale());
    weights.put("rankCap", settings.rankCap());
    weights.put("platformSignals", settings.platformSignals());
    return weights;
  }

  private Map<String, Object> storeSection() {
    return Map.of("root", store.rootPath().toString());
  }
}
