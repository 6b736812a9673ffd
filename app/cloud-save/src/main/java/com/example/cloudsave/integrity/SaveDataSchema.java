/*
 * どこで: Cloud Save 整合性検証
 * 何を: セーブデータの必須パス・型・制約・非推奨パス・既定値を宣言する
 * なぜ: 構造検証と破損時の既定値復元を同じ宣言から導出するため
 */
package com.example.cloudsave.integrity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SaveDataSchema(
    String version,
    List<String> requiredFields,
    Map<String, FieldKind> fieldKinds,
    Map<String, FieldConstraint> constraints,
    List<String> deprecatedFields,
    Map<String, JsonNode> defaults) {

  public SaveDataSchema {
    requiredFields = List.copyOf(requiredFields);
    fieldKinds = Collections.unmodifiableMap(new LinkedHashMap<>(fieldKinds));
    constraints = Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
    deprecatedFields = List.copyOf(deprecatedFields);
    defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
  }

  public static SaveDataSchema gameStateDefault() {
    final Map<String, FieldKind> kinds = new LinkedHashMap<>();
    kinds.put("player", FieldKind.OBJECT);
    kinds.put("player.name", FieldKind.STRING);
    kinds.put("player.level", FieldKind.NUMBER);
    kinds.put("player.experience", FieldKind.NUMBER);
    kinds.put("player.currentArea", FieldKind.STRING);
    kinds.put("player.stats", FieldKind.OBJECT);
    kinds.put("inventory", FieldKind.OBJECT);
    kinds.put("inventory.items", FieldKind.ARRAY);
    kinds.put("story", FieldKind.OBJECT);
    kinds.put("story.currentChapter", FieldKind.NUMBER);
    kinds.put("story.completedQuests", FieldKind.ARRAY);
    kinds.put("gameFlags", FieldKind.OBJECT);
    kinds.put("version", FieldKind.STRING);
    kinds.put("timestamp", FieldKind.STRING);

    final Map<String, FieldConstraint> constraints = new LinkedHashMap<>();
    constraints.put("player.level", FieldConstraint.range(1, 999));
    constraints.put("player.experience", FieldConstraint.range(0, 999_999_999));
    constraints.put("story.currentChapter", FieldConstraint.range(0, 100));
    constraints.put("inventory.items", FieldConstraint.maxLength(1000));

    final JsonNodeFactory nodes = JsonNodeFactory.instance;
    final ObjectNode stats = nodes.objectNode();
    stats.put("health", 100);
    stats.put("mana", 50);
    stats.put("strength", 10);
    stats.put("agility", 10);
    stats.put("intelligence", 10);
    stats.put("defense", 10);

    final Map<String, JsonNode> defaults = new LinkedHashMap<>();
    defaults.put("player.name", nodes.textNode("Unknown Player"));
    defaults.put("player.level", nodes.numberNode(1));
    defaults.put("player.experience", nodes.numberNode(0));
    defaults.put("player.currentArea", nodes.textNode("starting_area"));
    defaults.put("player.stats", stats);
    defaults.put("inventory.items", nodes.arrayNode());
    defaults.put("story.currentChapter", nodes.numberNode(0));
    defaults.put("story.completedQuests", nodes.arrayNode());
    defaults.put("gameFlags", nodes.objectNode());
    defaults.put("version", nodes.textNode("1.0.0"));
    defaults.put("timestamp", nodes.textNode("1970-01-01T00:00:00Z"));

    return new SaveDataSchema(
        "1.0.0",
        List.of("player", "inventory", "story", "gameFlags", "version", "timestamp"),
        kinds,
        constraints,
        List.of("oldPlayerData", "legacyFlags", "tempData"),
        defaults);
  }
}
