package com.onthegomap.tilestash.registry;

/** Handle returned by {@link DownloadTaskRegistry#subscribe(DownloadListener)}; closing it unsubscribes. */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

  @Override
  void close();
}
