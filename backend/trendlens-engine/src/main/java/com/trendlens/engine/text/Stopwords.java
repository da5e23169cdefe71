package com.trendlens.engine.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.en.EnglishAnalyzer;

public final class Stopwords {

  public static final String DEFAULT_RESOURCE = "/stopwords-headlines-en.txt";

  private final Set<String> merged;

  private Stopwords(Set<String> merged) {
    this.merged = merged;
  }

  public static Stopwords load(Optional<String> classpathFile, Collection<String> runtimeExtras) {
    Set<String> out = new HashSet<>();

    CharArraySet defaults = EnglishAnalyzer.getDefaultStopSet();
    for (Object token : defaults) {
      if (token instanceof char[] chars) {
        out.add(new String(chars));
      } else if (token != null) {
        out.add(token.toString());
      }
    }

    classpathFile.ifPresent(path -> out.addAll(readResource(path)));

    if (runtimeExtras != null) {
      runtimeExtras.stream()
          .filter(s -> s != null && !s.isBlank())
          .map(s -> s.strip().toLowerCase(Locale.ROOT))
          .forEach(out::add);
    }

    return new Stopwords(out);
  }

  public static Stopwords defaults() {
    return load(Optional.of(DEFAULT_RESOURCE), Set.of());
  }

  private static Set<String> readResource(String path) {
    Set<String> words = new HashSet<>();
    try (InputStream in = Stopwords.class.getResourceAsStream(path)) {
      if (in == null) {
        throw new IllegalStateException("Stopword list not found on classpath: " + path);
      }
      try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          line = line.strip();
          if (!line.isEmpty() && !line.startsWith("#")) {
            words.add(line.toLowerCase(Locale.ROOT));
          }
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read stopword list " + path, e);
    }
    return words;
  }

  public boolean contains(String token) {
    return merged.contains(token);
  }

  public int size() {
    return merged.size();
  }
}
