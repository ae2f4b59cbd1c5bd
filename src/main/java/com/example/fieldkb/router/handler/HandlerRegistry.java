package com.example.fieldkb.router.handler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Handlers keyed by lowercase vendor or equipment type. {@code generic} must be present;
 * {@code fallback} resolves to the generic handler when not registered.
 */
public class HandlerRegistry {

  public static final String GENERIC = "generic";
  public static final String FALLBACK = "fallback";

  private final Map<String, SpecialistHandler> handlers;

  public HandlerRegistry(Map<String, SpecialistHandler> handlers) {
    Map<String, SpecialistHandler> normalized = new LinkedHashMap<>();
    if (handlers != null) {
      handlers.forEach((key, handler) -> {
        if (key != null && !key.isBlank() && handler != null) {
          normalized.put(normalize(key), handler);
        }
      });
    }
    if (!normalized.containsKey(GENERIC)) {
      throw new IllegalStateException("Handler registry requires a '" + GENERIC + "' handler, got "
          + normalized.keySet());
    }
    normalized.putIfAbsent(FALLBACK, normalized.get(GENERIC));
    this.handlers = Collections.unmodifiableMap(normalized);
  }

  public Optional<SpecialistHandler> find(String key) {
    if (key == null || key.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(handlers.get(normalize(key)));
  }

  public boolean contains(String key) {
    return find(key).isPresent();
  }

  public SpecialistHandler generic() {
    return handlers.get(GENERIC);
  }

  public SpecialistHandler fallback() {
    return handlers.get(FALLBACK);
  }

  public Map<String, SpecialistHandler> asMap() {
    return handlers;
  }

  private static String normalize(String key) {
    return key.strip().toLowerCase(Locale.ROOT);
  }
}
