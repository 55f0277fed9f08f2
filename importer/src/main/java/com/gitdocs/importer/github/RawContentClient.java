package com.gitdocs.importer.github;

import com.gitdocs.importer.remote.ConditionalRequest;
import com.gitdocs.importer.remote.RawResponse;
import com.gitdocs.importer.remote.RemoteFetchException;
import com.gitdocs.importer.sync.SyncCancellation;
import com.gitdocs.importer.sync.SyncCancelledException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Plain HTTP downloads of raw file content. Successful and 304 responses are returned; any other
 * status becomes a {@link RemoteFetchException}, retried while it looks transient.
 */
class RawContentClient {

  private static final Logger log = LoggerFactory.getLogger(RawContentClient.class);

  private final WebClient webClient;
  private final RetryTemplate retryTemplate;
  private final Duration timeout;

  RawContentClient(WebClient webClient, RetryTemplate retryTemplate, Duration timeout) {
    this.webClient = Objects.requireNonNull(webClient, "webClient");
    this.retryTemplate = Objects.requireNonNull(retryTemplate, "retryTemplate");
    this.timeout = timeout != null ? timeout : Duration.ofSeconds(60);
  }

  RawResponse get(URI uri, ConditionalRequest conditions, SyncCancellation cancellation) {
    ConditionalRequest effective = conditions != null ? conditions : ConditionalRequest.none();
    return retryTemplate.execute(
        context -> {
          if (context.getRetryCount() > 0) {
            log.debug("Retrying {} (attempt {})", uri, context.getRetryCount() + 1);
          }
          return exchange(uri, effective, cancellation);
        });
  }

  byte[] download(URI uri, SyncCancellation cancellation) {
    RawResponse response = get(uri, ConditionalRequest.none(), cancellation);
    if (!response.isSuccess()) {
      throw new RemoteFetchException(
          "Unexpected status %d downloading %s".formatted(response.status(), uri),
          response.status());
    }
    return response.body();
  }

  private RawResponse exchange(
      URI uri, ConditionalRequest conditions, SyncCancellation cancellation) {
    cancellation.throwIfCancelled();
    Mono<RawResponse> call =
        webClient
            .get()
            .uri(uri)
            .headers(
                headers -> {
                  if (conditions.etag() != null) {
                    headers.set(HttpHeaders.IF_NONE_MATCH, conditions.etag());
                  } else if (conditions.lastModified() != null) {
                    headers.set(HttpHeaders.IF_MODIFIED_SINCE, conditions.lastModified());
                  }
                })
            .exchangeToMono(this::toRawResponse);
    RawResponse response;
    try {
      response = call.takeUntilOther(cancellation.signal()).block(timeout);
    } catch (RemoteFetchException | SyncCancelledException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new RemoteFetchException(
          "Request to %s failed: %s".formatted(uri, ex.getMessage()), ex);
    }
    if (response == null) {
      cancellation.throwIfCancelled();
      throw new RemoteFetchException("Empty response from " + uri, 0);
    }
    if (response.isSuccess() || response.isNotModified()) {
      return response;
    }
    throw new RemoteFetchException(
        "Unexpected status %d fetching %s".formatted(response.status(), uri), response.status());
  }

  private Mono<RawResponse> toRawResponse(ClientResponse response) {
    HttpHeaders headers = response.headers().asHttpHeaders();
    int status = response.statusCode().value();
    String etag = headers.getFirst(HttpHeaders.ETAG);
    String lastModified = headers.getFirst(HttpHeaders.LAST_MODIFIED);
    return response
        .bodyToMono(byte[].class)
        .defaultIfEmpty(new byte[0])
        .map(body -> new RawResponse(status, body, etag, lastModified));
  }
}
