package com.robomania.botconfig;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BotConfiguration {
  private static final Logger logger = LoggerFactory.getLogger(BotConfiguration.class);

  public static final String DEFAULT_TIMEZONE = "Asia/Taipei";
  public static final String DEFAULT_PANEL_URL = "https://frc7636.dpdns.org";
  public static final long DEFAULT_STALE_FIRE_WINDOW_SECONDS = 1000;
  public static final int DEFAULT_MAX_RETRIES = 15;
  public static final long DEFAULT_BASE_RETRY_DELAY_SECONDS = 2;
  public static final long DEFAULT_MAX_RETRY_DELAY_SECONDS = 900;
  public static final long DEFAULT_HTTP_TIMEOUT_SECONDS = 10;
  public static final long DEFAULT_RELAY_TIMEOUT_SECONDS = 15;

  private final Map<String, String> environment;

  private final String discordBotToken;
  private final String robowebApiUrl;
  private final String robowebApiToken;
  private final String websocketUrl;
  private final long guildId;
  private final long announceChannelId;
  private final long notifyChannelId;
  private final long absentRequestChannelId;
  private final long adminRoleId;
  private final long ownerId;
  private final ZoneId timezone;
  private final String panelUrl;
  private final Duration staleFireWindow;
  private final int maxRetries;
  private final Duration baseRetryDelay;
  private final Duration maxRetryDelay;
  private final Duration httpTimeout;
  private final Duration relayTimeout;

  private static BotConfiguration instance;

  private BotConfiguration() {
    this(System.getenv());
  }

  BotConfiguration(final Map<String, String> environment) {
    this.environment = environment;

    this.discordBotToken = validateRequired("DISCORD_BOT_TOKEN");
    this.robowebApiUrl = withTrailingSlash(validateRequired("ROBOWEB_API_URL"));
    this.robowebApiToken = validateRequired("ROBOWEB_API_TOKEN");
    this.websocketUrl = withTrailingSlash(validateRequired("WS_URL"));

    this.guildId = optionalLong("GUILD_ID", 0L);
    this.announceChannelId = optionalLong("ANNOUNCE_CHANNEL_ID", 1128232150135738529L);
    this.notifyChannelId = optionalLong("NOTIFY_CHANNEL_ID", 1128232150135738529L);
    this.absentRequestChannelId = optionalLong("ABSENT_REQ_CHANNEL_ID", 1126031617614426142L);
    this.adminRoleId = optionalLong("ADMIN_ROLE_ID", 1114205838144454807L);
    this.ownerId = optionalLong("BOT_OWNER_ID", 0L);
    this.timezone = ZoneId.of(optional("BOT_TIMEZONE", DEFAULT_TIMEZONE));
    this.panelUrl = stripTrailingSlash(optional("PANEL_URL", DEFAULT_PANEL_URL));
    this.staleFireWindow =
        Duration.ofSeconds(
            optionalLong("STALE_FIRE_WINDOW_SECONDS", DEFAULT_STALE_FIRE_WINDOW_SECONDS));
    this.maxRetries = (int) optionalLong("WS_MAX_RETRIES", DEFAULT_MAX_RETRIES);
    this.baseRetryDelay =
        Duration.ofSeconds(
            optionalLong("WS_BASE_RETRY_DELAY_SECONDS", DEFAULT_BASE_RETRY_DELAY_SECONDS));
    this.maxRetryDelay =
        Duration.ofSeconds(
            optionalLong("WS_MAX_RETRY_DELAY_SECONDS", DEFAULT_MAX_RETRY_DELAY_SECONDS));
    this.httpTimeout =
        Duration.ofSeconds(optionalLong("HTTP_TIMEOUT_SECONDS", DEFAULT_HTTP_TIMEOUT_SECONDS));
    this.relayTimeout =
        Duration.ofSeconds(optionalLong("RELAY_TIMEOUT_SECONDS", DEFAULT_RELAY_TIMEOUT_SECONDS));

    logger.info("Bot configuration initialized successfully");
  }

  public static BotConfiguration getInstance() {
    if (instance == null) {
      instance = new BotConfiguration();
    }
    return instance;
  }

  public String getDiscordBotToken() {
    return discordBotToken;
  }

  public String getRobowebApiUrl() {
    return robowebApiUrl;
  }

  public String getRobowebApiToken() {
    return robowebApiToken;
  }

  public String getWebsocketUrl() {
    return websocketUrl;
  }

  public long getGuildId() {
    return guildId;
  }

  public long getAnnounceChannelId() {
    return announceChannelId;
  }

  public long getNotifyChannelId() {
    return notifyChannelId;
  }

  public long getAbsentRequestChannelId() {
    return absentRequestChannelId;
  }

  public long getAdminRoleId() {
    return adminRoleId;
  }

  public long getOwnerId() {
    return ownerId;
  }

  public ZoneId getTimezone() {
    return timezone;
  }

  public String getPanelUrl() {
    return panelUrl;
  }

  public Duration getStaleFireWindow() {
    return staleFireWindow;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public Duration getBaseRetryDelay() {
    return baseRetryDelay;
  }

  public Duration getMaxRetryDelay() {
    return maxRetryDelay;
  }

  public Duration getHttpTimeout() {
    return httpTimeout;
  }

  public Duration getRelayTimeout() {
    return relayTimeout;
  }

  public void validateConfiguration() {
    logger.info("Validating bot configuration...");

    if (!robowebApiUrl.startsWith("http://") && !robowebApiUrl.startsWith("https://")) {
      throw new IllegalStateException("ROBOWEB_API_URL must start with http:// or https://");
    }

    if (!websocketUrl.startsWith("ws://") && !websocketUrl.startsWith("wss://")) {
      throw new IllegalStateException("WS_URL must start with ws:// or wss://");
    }

    if (maxRetries < 1) {
      throw new IllegalStateException("WS_MAX_RETRIES must be at least 1");
    }

    if (guildId == 0L) {
      logger.warn("GUILD_ID not set; initial data requests will be ignored");
    }

    if (ownerId == 0L) {
      logger.warn("BOT_OWNER_ID not set; owner-only commands are disabled");
    }

    logger.info("Bot configuration validation completed successfully");
  }

  private String validateRequired(final String envVarName) {
    final String value = environment.get(envVarName);
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalStateException(envVarName + " environment variable is required but not set");
    }
    return value.trim();
  }

  private String optional(final String envVarName, final String defaultValue) {
    final String value = environment.get(envVarName);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    return value.trim();
  }

  private long optionalLong(final String envVarName, final long defaultValue) {
    final String value = optional(envVarName, null);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (final NumberFormatException e) {
      throw new IllegalStateException(envVarName + " must be a number but was: " + value, e);
    }
  }

  private static String withTrailingSlash(final String url) {
    return url.endsWith("/") ? url : url + "/";
  }

  private static String stripTrailingSlash(final String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
