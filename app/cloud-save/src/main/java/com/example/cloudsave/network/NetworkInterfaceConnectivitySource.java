/*
 * どこで: Cloud Save ネットワーク監視
 * 何を: OS のネットワークインターフェースから受動的な接続状態を推定する
 * なぜ: プローブより安価な一次判定として、明らかなオフラインを即座に検出するため
 */
package com.example.cloudsave.network;

import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Enumeration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NetworkInterfaceConnectivitySource implements PassiveConnectivitySource {

  private static final Logger logger =
      LoggerFactory.getLogger(NetworkInterfaceConnectivitySource.class);

  @Override
  public boolean isOnline() {
    try {
      return firstActiveInterface() != null;
    } catch (SocketException ex) {
      // 判定できない場合はオンライン扱いにし、到達性はプローブに委ねる
      logger.warn("network interface inspection failed reason={}", ex.getMessage());
      return true;
    }
  }

  @Override
  public ConnectionInfo connectionInfo() {
    try {
      final NetworkInterface active = firstActiveInterface();
      if (active == null) {
        return new ConnectionInfo(ConnectionType.NONE, EffectiveConnectionType.UNKNOWN, 0, 0, false);
      }
      return new ConnectionInfo(
          classify(active.getName()), EffectiveConnectionType.UNKNOWN, 0, 0, false);
    } catch (SocketException ex) {
      logger.warn("network interface inspection failed reason={}", ex.getMessage());
      return ConnectionInfo.unknown();
    }
  }

  private NetworkInterface firstActiveInterface() throws SocketException {
    final Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
    if (interfaces == null) {
      return null;
    }
    while (interfaces.hasMoreElements()) {
      final NetworkInterface candidate = interfaces.nextElement();
      if (candidate.isUp() && !candidate.isLoopback() && !candidate.isVirtual()) {
        return candidate;
      }
    }
    return null;
  }

  static ConnectionType classify(String interfaceName) {
    final String name = interfaceName == null ? "" : interfaceName.toLowerCase(Locale.ROOT);
    if (name.startsWith("wl") || name.startsWith("wifi")) {
      return ConnectionType.WIFI;
    }
    if (name.startsWith("eth") || name.startsWith("en")) {
      return ConnectionType.ETHERNET;
    }
    if (name.startsWith("wwan") || name.startsWith("rmnet") || name.startsWith("ccmni")) {
      return ConnectionType.CELLULAR;
    }
    return ConnectionType.UNKNOWN;
  }
}
