package com.example.cloudsave.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared test data. The mapper mirrors the Spring Boot defaults for java.time values. */
public final class GameStateFixtures {

  private GameStateFixtures() {}

  public static ObjectMapper objectMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();
  }

  public static ObjectNode validGameState(int level) {
    final ObjectNode state = JsonNodeFactory.instance.objectNode();
    final ObjectNode player = state.putObject("player");
    player.put("name", "Aria").put("level", level).put("experience", 1200).put("currentArea", "harbor");
    player
        .putObject("stats")
        .put("health", 120)
        .put("mana", 40)
        .put("strength", 12)
        .put("agility", 9)
        .put("intelligence", 11)
        .put("defense", 8);
    state.putObject("inventory").putArray("items").addObject().put("id", "sword").put("quantity", 1);
    final ObjectNode story = state.putObject("story");
    story.put("currentChapter", 2);
    story.putArray("completedQuests").add("prologue");
    state.putObject("gameFlags").put("metGuide", true);
    state.put("version", "1.0.0");
    state.put("timestamp", "2026-02-01T00:00:00Z");
    return state;
  }
}
