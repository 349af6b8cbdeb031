package com.agenthums.backend.auth.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.springframework.lang.Nullable;

/**
 * Validated actor preferences. The core keys are checked and replaced by defaults when invalid;
 * every other key is carried through untouched.
 */
public final class UserPreferences {

  public enum Theme {
    LIGHT,
    DARK,
    AUTO;

    static Optional<Theme> parse(@Nullable String value) {
      return parseEnum(Theme.class, value);
    }
  }

  public enum CommunicationStyle {
    FORMAL,
    INFORMAL,
    NEUTRAL;

    static Optional<CommunicationStyle> parse(@Nullable String value) {
      return parseEnum(CommunicationStyle.class, value);
    }
  }

  public record Notifications(boolean email, boolean browser, boolean updates) {

    public static final Notifications DEFAULT = new Notifications(true, true, false);

    static Notifications fromJson(@Nullable JsonNode node) {
      if (node == null || !node.isObject()) {
        return DEFAULT;
      }
      return new Notifications(
          booleanOr(node.get("email"), DEFAULT.email()),
          booleanOr(node.get("browser"), DEFAULT.browser()),
          booleanOr(node.get("updates"), DEFAULT.updates()));
    }

    private static boolean booleanOr(@Nullable JsonNode node, boolean fallback) {
      return node != null && node.isBoolean() ? node.booleanValue() : fallback;
    }
  }

  private static final Set<String> CORE_KEYS =
      Set.of(
          "theme", "language", "defaultModel", "communicationStyle", "interests", "notifications");

  private static final UserPreferences DEFAULTS =
      new UserPreferences(Theme.AUTO, "en", null, null, List.of(), Notifications.DEFAULT, Map.of());

  private final Theme theme;
  private final String language;
  @Nullable private final String defaultModel;
  @Nullable private final CommunicationStyle communicationStyle;
  private final List<String> interests;
  private final Notifications notifications;
  private final Map<String, JsonNode> extra;

  private UserPreferences(
      Theme theme,
      String language,
      @Nullable String defaultModel,
      @Nullable CommunicationStyle communicationStyle,
      List<String> interests,
      Notifications notifications,
      Map<String, JsonNode> extra) {
    this.theme = theme;
    this.language = language;
    this.defaultModel = defaultModel;
    this.communicationStyle = communicationStyle;
    this.interests = List.copyOf(interests);
    this.notifications = notifications;
    this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  public static UserPreferences defaults() {
    return DEFAULTS;
  }

  public static UserPreferences fromJson(@Nullable JsonNode node) {
    if (node == null || !node.isObject()) {
      return DEFAULTS;
    }
    Theme theme = Theme.parse(textOrNull(node.get("theme"))).orElse(DEFAULTS.theme);
    String language =
        Optional.ofNullable(textOrNull(node.get("language"))).orElse(DEFAULTS.language);
    String defaultModel = textOrNull(node.get("defaultModel"));
    CommunicationStyle style =
        CommunicationStyle.parse(textOrNull(node.get("communicationStyle"))).orElse(null);
    List<String> interests = new ArrayList<>();
    JsonNode interestsNode = node.get("interests");
    if (interestsNode != null && interestsNode.isArray()) {
      interestsNode.forEach(
          item -> {
            if (item.isTextual() && !item.asText().isBlank()) {
              interests.add(item.asText().trim());
            }
          });
    }
    Notifications notifications = Notifications.fromJson(node.get("notifications"));

    Map<String, JsonNode> extra = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!CORE_KEYS.contains(field.getKey())) {
        extra.put(field.getKey(), field.getValue().deepCopy());
      }
    }
    return new UserPreferences(
        theme, language, defaultModel, style, interests, notifications, extra);
  }

  /** Shallow merge of {@code patch} over the current values, then re-validated. */
  public UserPreferences merge(@Nullable JsonNode patch) {
    ObjectNode merged = toJson();
    if (patch != null && patch.isObject()) {
      patch.fields().forEachRemaining(field -> merged.set(field.getKey(), field.getValue()));
    }
    return fromJson(merged);
  }

  @JsonValue
  public ObjectNode toJson() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    extra.forEach((key, value) -> node.set(key, value.deepCopy()));
    node.put("theme", theme.name().toLowerCase(Locale.ROOT));
    node.put("language", language);
    if (defaultModel != null) {
      node.put("defaultModel", defaultModel);
    }
    if (communicationStyle != null) {
      node.put("communicationStyle", communicationStyle.name().toLowerCase(Locale.ROOT));
    }
    if (!interests.isEmpty()) {
      ArrayNode array = node.putArray("interests");
      interests.forEach(array::add);
    }
    ObjectNode notificationsNode = node.putObject("notifications");
    notificationsNode.put("email", notifications.email());
    notificationsNode.put("browser", notifications.browser());
    notificationsNode.put("updates", notifications.updates());
    return node;
  }

  public Theme getTheme() {
    return theme;
  }

  public String getLanguage() {
    return language;
  }

  public Optional<String> getDefaultModel() {
    return Optional.ofNullable(defaultModel);
  }

  public Optional<CommunicationStyle> getCommunicationStyle() {
    return Optional.ofNullable(communicationStyle);
  }

  public List<String> getInterests() {
    return interests;
  }

  public Notifications getNotifications() {
    return notifications;
  }

  public Map<String, JsonNode> getExtra() {
    return extra;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof UserPreferences that)) {
      return false;
    }
    return toJson().equals(that.toJson());
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        theme, language, defaultModel, communicationStyle, interests, notifications);
  }

  @Override
  public String toString() {
    return toJson().toString();
  }

  @Nullable
  private static String textOrNull(@Nullable JsonNode node) {
    if (node == null || !node.isTextual()) {
      return null;
    }
    String text = node.asText().trim();
    return text.isEmpty() ? null : text;
  }

  private static <E extends Enum<E>> Optional<E> parseEnum(Class<E> type, @Nullable String value) {
    if (value == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
