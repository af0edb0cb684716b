package com.codeheadsystems.warden.client.model;

/**
 * Device description sent with a registration.
 *
 * @param model     the device model
 * @param osVersion the operating system version
 */
public record DeviceMetadata(String model, String osVersion) {

  /**
   * Describes the current JVM host from its system properties.
   *
   * @return the device metadata
   */
  public static DeviceMetadata current() {
    String os = System.getProperty("os.name", "unknown");
    String arch = System.getProperty("os.arch", "unknown");
    String version = System.getProperty("os.version", "unknown");
    return new DeviceMetadata(os + " " + arch, os + " " + version);
  }
}
