package com.example.fieldkb.router.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.fieldkb.router.model.HandlerResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HandlerRegistryTest {

  private static SpecialistHandler named(String text) {
    return (request, coverage) -> new HandlerResult(text, List.of(), 0.5);
  }

  @Test
  void startupFailsWithoutGenericHandler() {
    assertThatThrownBy(() -> new HandlerRegistry(Map.of("siemens", named("s"))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("generic");
  }

  @Test
  void fallbackDefaultsToGeneric() {
    SpecialistHandler generic = named("g");
    HandlerRegistry registry = new HandlerRegistry(Map.of("generic", generic));

    assertThat(registry.fallback()).isSameAs(generic);
  }

  @Test
  void explicitFallbackIsKept() {
    SpecialistHandler fallback = named("f");
    HandlerRegistry registry = new HandlerRegistry(Map.of("generic", named("g"), "fallback", fallback));

    assertThat(registry.fallback()).isSameAs(fallback);
  }

  @Test
  void keysAreCaseInsensitive() {
    SpecialistHandler siemens = named("s");
    HandlerRegistry registry = new HandlerRegistry(Map.of("Generic", named("g"), " SIEMENS ", siemens));

    assertThat(registry.find("siemens")).containsSame(siemens);
    assertThat(registry.find("Siemens")).containsSame(siemens);
    assertThat(registry.contains("rockwell")).isFalse();
    assertThat(registry.find(null)).isEmpty();
    assertThat(registry.asMap()).containsOnlyKeys("generic", "siemens", "fallback");
  }
}
