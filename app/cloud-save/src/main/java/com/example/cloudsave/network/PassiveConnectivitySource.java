package com.example.cloudsave.network;

/** Cheap, local connectivity signal. May report online while the internet is unreachable. */
public interface PassiveConnectivitySource {

  boolean isOnline();

  ConnectionInfo connectionInfo();
}
