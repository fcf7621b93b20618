package dev.compass.router;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Router settings bound from {@code compass.router.*}.
 *
 * @param historyCapacity number of routing history entries kept in memory
 */
@ConfigurationProperties(prefix = "compass.router")
public record RouterProperties(@DefaultValue("1000") int historyCapacity) {

  public RouterProperties {
    if (historyCapacity < 1) {
      throw new IllegalStateException(
          "compass.router.history-capacity must be positive, got: " + historyCapacity);
    }
  }
}
