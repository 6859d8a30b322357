package org.hypertrace.core.report.query.extension;

import com.typesafe.config.Config;
import java.util.List;
import java.util.Set;
import lombok.Value;

/** A messaging channel (email, sms, ...) that may contribute columns to cross-channel reports. */
@Value
public class Channel {
  private static final String CONFIG_PATH_NAME = "name";
  private static final String CONFIG_PATH_LABEL = "label";
  private static final String CONFIG_PATH_FEATURES = "features";

  String name;
  String label;
  Set<String> features;

  static Channel from(Config config) {
    return new Channel(
        config.getString(CONFIG_PATH_NAME),
        config.hasPath(CONFIG_PATH_LABEL)
            ? config.getString(CONFIG_PATH_LABEL)
            : config.getString(CONFIG_PATH_NAME),
        Set.copyOf(
            config.hasPath(CONFIG_PATH_FEATURES)
                ? config.getStringList(CONFIG_PATH_FEATURES)
                : List.of()));
  }

  public boolean hasFeature(String feature) {
    return features.contains(feature);
  }
}
