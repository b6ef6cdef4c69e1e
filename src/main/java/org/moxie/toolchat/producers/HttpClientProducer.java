package org.moxie.toolchat.producers;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Client used for outbound delivery webhooks.
 */
@ApplicationScoped
public class HttpClientProducer {

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  @Produces
  @Singleton
  public HttpClient getDeliveryClient() {
    return HttpClient.newBuilder()
                     .connectTimeout(CONNECT_TIMEOUT)
                     .followRedirects(HttpClient.Redirect.NORMAL)
                     .build();
  }
}
