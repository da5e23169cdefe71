package com.trendlens.api.controller;

import com.trendlens.engine.config.EngineSettings;
import com.trendlens.engine.config.StoreProperties;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.endsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

  @TestConfiguration
  static class Settings {

    @Bean
    EngineSettings engineSettings() {
      return EngineSettings.builder()
          .weights(0.5, 0.3, 0.2)
          .watchKeywords(List.of("AI", "election"))
          .platformSignal("weibo", EngineSettings.PlatformSignal.HOTNESS)
          .build();
    }

    @Bean
    StoreProperties storeProperties() {
      return new StoreProperties("/var/lib/trendlens/snapshots");
    }
  }

  @Autowired
  private MockMvc mvc;

  @Test
  void everySectionByDefault() throws Exception {
    mvc.perform(get("/api/config"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.engine.rankWeight").value(0.5))
        .andExpect(jsonPath("$.engine.watchKeywords[1]").value("election"))
        .andExpect(jsonPath("$.engine.zone").value("UTC"))
        .andExpect(jsonPath("$.store.root").value(endsWith("snapshots")));
  }

  @Test
  void weightsSectionOnly() throws Exception {
    mvc.perform(get("/api/config").param("section", "Weights"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.weights.hotnessWeight").value(0.2))
        .andExpect(jsonPath("$.weights.platformSignals.weibo").value("HOTNESS"))
        .andExpect(jsonPath("$.engine").doesNotExist());
  }

  @Test
  void keywordsSectionOnly() throws Exception {
    mvc.perform(get("/api/config").param("section", "keywords"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.keywords.watchKeywords[0]").value("AI"));
  }

  @Test
  void unknownSectionIsRejected() throws Exception {
    mvc.perform(get("/api/config").param("section", "push"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }
}
