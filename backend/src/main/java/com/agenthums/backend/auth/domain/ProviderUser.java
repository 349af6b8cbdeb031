package com.agenthums.backend.auth.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/** User record as issued by the identity provider. Metadata objects are never null. */
public record ProviderUser(
    UUID id,
    @Nullable String email,
    @Nullable Instant emailConfirmedAt,
    @Nullable Instant lastSignInAt,
    @Nullable Instant createdAt,
    ObjectNode userMetadata,
    ObjectNode appMetadata) {

  public ProviderUser {
    Objects.requireNonNull(id, "id");
    userMetadata =
        userMetadata != null ? userMetadata.deepCopy() : JsonNodeFactory.instance.objectNode();
    appMetadata =
        appMetadata != null ? appMetadata.deepCopy() : JsonNodeFactory.instance.objectNode();
  }

  public boolean emailConfirmed() {
    return emailConfirmedAt != null;
  }

  public Optional<String> metadataText(String key) {
    JsonNode value = userMetadata.get(key);
    if (value == null || !value.isTextual()) {
      return Optional.empty();
    }
    String text = value.asText().trim();
    return StringUtils.hasText(text) ? Optional.of(text) : Optional.empty();
  }

  public ProviderUser withUserMetadata(ObjectNode metadata) {
    return new ProviderUser(
        id, email, emailConfirmedAt, lastSignInAt, createdAt, metadata, appMetadata);
  }
}
