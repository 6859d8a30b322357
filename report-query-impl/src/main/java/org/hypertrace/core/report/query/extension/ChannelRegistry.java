package org.hypertrace.core.report.query.extension;

import com.typesafe.config.Config;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Read-only list of the channels known to the reporting system, in registration order. */
public class ChannelRegistry {
  private final List<Channel> channels;

  public ChannelRegistry(List<Channel> channels) {
    this.channels = List.copyOf(channels);
  }

  public static ChannelRegistry parse(List<? extends Config> channelConfigs) {
    return new ChannelRegistry(
        channelConfigs.stream().map(Channel::from).collect(Collectors.toUnmodifiableList()));
  }

  public List<Channel> getChannels() {
    return channels;
  }

  public List<String> getChannelNames() {
    return channels.stream().map(Channel::getName).collect(Collectors.toUnmodifiableList());
  }

  public Optional<Channel> getChannel(String name) {
    return channels.stream().filter(channel -> channel.getName().equals(name)).findFirst();
  }

  public List<Channel> getChannelsWithFeature(String feature) {
    return channels.stream()
        .filter(channel -> channel.hasFeature(feature))
        .collect(Collectors.toUnmodifiableList());
  }
}
