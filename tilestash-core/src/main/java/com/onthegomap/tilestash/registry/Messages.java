package com.onthegomap.tilestash.registry;

import java.util.Locale;
import java.util.ResourceBundle;

/**
 * User-facing error messages attached to download tasks, in English or Brazilian Portuguese.
 */
public class Messages {

  private static final String BUNDLE = "com.onthegomap.tilestash.registry.messages";

  private final ResourceBundle bundle;

  private Messages(ResourceBundle bundle) {
    this.bundle = bundle;
  }

  public static Messages forLocale(Locale locale) {
    return new Messages(ResourceBundle.getBundle(BUNDLE, locale,
      ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES)));
  }

  public String noConnection() {
    return bundle.getString("error.no_connection");
  }

  public String downloadFailed() {
    return bundle.getString("error.download_failed");
  }

  public String interrupted() {
    return bundle.getString("error.interrupted");
  }

  public String unknownError() {
    return bundle.getString("error.unknown");
  }
}
