package org.traceplayer.utils;

import org.traceplayer.model.Channel;

import javafx.scene.paint.Color;

/**
 * Conventional chromatogram colors: A green, T red, G black, C blue.
 */
public final class BaseColors {

  private BaseColors() {} // Utility class

  public static final Color COLOR_A = Color.web("#00AA00");
  public static final Color COLOR_T = Color.web("#FF0000");
  public static final Color COLOR_G = Color.web("#000000");
  public static final Color COLOR_C = Color.web("#0000FF");
  public static final Color COLOR_N = Color.web("#666666");
  public static final Color LOW_QUALITY = Color.web("#CCCCCC");

  /**
   * Get the color for a base call. Anything but A, T, G or C is gray.
   */
  public static Color getBaseColor(char base) {
    return switch (Character.toUpperCase(base)) {
      case 'A' -> COLOR_A;
      case 'T' -> COLOR_T;
      case 'G' -> COLOR_G;
      case 'C' -> COLOR_C;
      default -> COLOR_N;
    };
  }

  public static Color getChannelColor(Channel channel) {
    return getBaseColor(channel.symbol());
  }
}
