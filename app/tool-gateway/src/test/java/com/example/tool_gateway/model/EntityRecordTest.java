package com.example.tool_gateway.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EntityRecordTest {

  @Test
  void metadataKeepsUpstreamKeyOrder() {
    final Map<String, String> metadata = new LinkedHashMap<>();
    for (int i = 0; i < 8; i++) {
      metadata.put("k" + i, "v" + i);
    }

    final EntityRecord entity = new EntityRecord("e1", "name", "ops", metadata);

    assertThat(entity.metadata().keySet())
        .containsExactly("k0", "k1", "k2", "k3", "k4", "k5", "k6", "k7");
  }

  @Test
  void metadataIsDetachedAndReadOnly() {
    final Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("owner", "sre");
    final EntityRecord entity = new EntityRecord("e1", "name", "ops", metadata);

    metadata.put("late", "x");

    assertThat(entity.metadata()).containsOnlyKeys("owner");
    assertThatThrownBy(() -> entity.metadata().put("x", "y"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void missingMetadataDefaultsToEmpty() {
    assertThat(new EntityRecord("e1", "name", "ops", null).metadata()).isEmpty();
  }

  @Test
  void completenessRequiresIdNameAndCategory() {
    assertThat(new EntityRecord("e1", "name", "ops", null).isComplete()).isTrue();
    assertThat(new EntityRecord(" ", "name", "ops", null).isComplete()).isFalse();
    assertThat(new EntityRecord("e1", null, "ops", null).isComplete()).isFalse();
    assertThat(new EntityRecord("e1", "name", null, null).isComplete()).isFalse();
  }
}
