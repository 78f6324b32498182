package logpipe.dispatch;

import logpipe.Destination;

import java.util.Objects;

/**
 * Pairs a {@link Destination} with the {@link SlotConfig} its slot is built from.
 */
public record DestinationBinding(Destination destination, SlotConfig config) {

  public DestinationBinding {
    Objects.requireNonNull(destination, "destination");
    config = config == null ? SlotConfig.defaults() : config;
  }

  /**
   * Binds a destination with the default (immediate, unfiltered) configuration.
   */
  public static DestinationBinding of(Destination destination) {
    return new DestinationBinding(destination, SlotConfig.defaults());
  }

  public static DestinationBinding of(Destination destination, SlotConfig config) {
    return new DestinationBinding(destination, config);
  }
}
