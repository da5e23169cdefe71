package com.trendlens.engine.text;

import java.util.Set;

public interface EntityExtractor {

  Set<String> extract(String title);
}
