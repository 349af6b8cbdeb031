package com.agenthums.backend.auth.provider;

import com.agenthums.backend.auth.domain.ProviderUser;
import com.agenthums.backend.auth.domain.Session;
import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.UUID;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

final class GoTrueJson {

  private GoTrueJson() {}

  static boolean hasSession(@Nullable JsonNode node) {
    return node != null && StringUtils.hasText(node.path("access_token").asText(null));
  }

  static Session parseSession(JsonNode node, Clock clock) {
    if (!hasSession(node)) {
      throw new AuthException(
          AuthErrorKind.PROVIDER_REJECTED, "Provider response carries no session");
    }
    Instant expiresAt = null;
    if (node.hasNonNull("expires_at")) {
      expiresAt = Instant.ofEpochSecond(node.get("expires_at").asLong());
    } else if (node.hasNonNull("expires_in")) {
      expiresAt = clock.instant().plusSeconds(node.get("expires_in").asLong());
    }
    return new Session(
        node.get("access_token").asText(),
        textOrNull(node, "refresh_token"),
        textOrNull(node, "token_type"),
        expiresAt,
        parseUser(node.path("user")));
  }

  static ProviderUser parseUser(JsonNode node) {
    String id = textOrNull(node, "id");
    if (id == null) {
      throw new AuthException(AuthErrorKind.PROVIDER_REJECTED, "Provider response carries no user");
    }
    Instant confirmedAt = instantOrNull(node, "email_confirmed_at");
    if (confirmedAt == null) {
      confirmedAt = instantOrNull(node, "confirmed_at");
    }
    return new ProviderUser(
        UUID.fromString(id),
        textOrNull(node, "email"),
        confirmedAt,
        instantOrNull(node, "last_sign_in_at"),
        instantOrNull(node, "created_at"),
        objectOrNull(node, "user_metadata"),
        objectOrNull(node, "app_metadata"));
  }

  /** Reads the error code from either the legacy OAuth style body or the newer one. */
  @Nullable
  static String errorCode(@Nullable JsonNode body) {
    if (body == null) {
      return null;
    }
    String code = textOrNull(body, "error_code");
    return code != null ? code : textOrNull(body, "error");
  }

  @Nullable
  static String errorMessage(@Nullable JsonNode body) {
    if (body == null) {
      return null;
    }
    for (String field : new String[] {"msg", "error_description", "message"}) {
      String value = textOrNull(body, field);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  @Nullable
  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return StringUtils.hasText(text) ? text : null;
  }

  @Nullable
  private static ObjectNode objectOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value instanceof ObjectNode objectNode ? objectNode : null;
  }

  @Nullable
  private static Instant instantOrNull(JsonNode node, String field) {
    String text = textOrNull(node, field);
    if (text == null) {
      return null;
    }
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException ex) {
      return Instant.parse(text);
    }
  }
}
