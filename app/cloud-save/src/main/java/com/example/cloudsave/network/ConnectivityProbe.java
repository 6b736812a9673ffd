package com.example.cloudsave.network;

/** One active reachability attempt with its own hard timeout. */
@FunctionalInterface
public interface ConnectivityProbe {

  /**
   * @return {@code true} when the remote endpoint answered at all
   * @throws RuntimeException when the attempt failed; treated the same as {@code false}
   */
  boolean isReachable();
}
