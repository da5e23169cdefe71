package com.trendlens.engine.analytics;

public enum LifecyclePhase {
  FLASH,
  SUSTAINED,
  EMERGING,
  FADING
}
