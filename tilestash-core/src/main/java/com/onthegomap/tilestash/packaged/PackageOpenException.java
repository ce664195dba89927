package com.onthegomap.tilestash.packaged;

/** Thrown when a package file is missing from the registry or cannot be read as an MBTiles database. */
public class PackageOpenException extends RuntimeException {

  public PackageOpenException(String message) {
    super(message);
  }

  public PackageOpenException(String message, Throwable cause) {
    super(message, cause);
  }
}
