/*
 * どこで: Cloud Save ネットワーク監視
 * 何を: ping URL へ HEAD リクエストを送り、外部到達性を確認する
 * なぜ: ローカルのインターフェース状態だけでは captive portal や上流断を検出できないため
 */
package com.example.cloudsave.network;

import com.example.cloudsave.config.CloudSaveProperties;
import java.net.URI;
import java.net.http.HttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class HttpConnectivityProbe implements ConnectivityProbe {

  private static final Logger logger = LoggerFactory.getLogger(HttpConnectivityProbe.class);

  private final RestClient restClient;
  private final URI pingUri;

  public HttpConnectivityProbe(RestClient restClient, URI pingUri) {
    this.restClient = restClient;
    this.pingUri = pingUri;
  }

  /** Builds a probe whose connect and read timeouts both equal {@code ping-timeout}. */
  public static HttpConnectivityProbe create(
      RestClient.Builder builder, CloudSaveProperties.Network properties) {
    final HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(properties.pingTimeout())
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.pingTimeout());
    return new HttpConnectivityProbe(
        builder.clone().requestFactory(requestFactory).build(), URI.create(properties.pingUrl()));
  }

  @Override
  public boolean isReachable() {
    try {
      restClient.head().uri(pingUri).retrieve().toBodilessEntity();
      return true;
    } catch (RestClientResponseException ex) {
      // どんなステータスでも応答が返れば到達可能とみなす
      return true;
    } catch (ResourceAccessException ex) {
      logger.debug("connectivity probe failed url={} reason={}", pingUri, ex.getMessage());
      return false;
    }
  }
}
