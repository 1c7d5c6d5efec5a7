package io.b2mash.b2b.einvoice.authority;

import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

/**
 * SOAP 1.2 over HTTP using Spring's {@link RestClient}.
 *
 * <p>The reply body is returned whatever the status, because the service reports SOAP faults with
 * HTTP 500 and the fault text is what the parser needs. An error status without a body fails with
 * {@link AuthorityProtocolException}.
 */
@Component
@ConditionalOnProperty(name = "authority.mode", havingValue = "live")
public class HttpAuthorityTransport implements AuthorityTransport {

  private static final Logger log = LoggerFactory.getLogger(HttpAuthorityTransport.class);

  private final RestClient restClient;

  @Autowired
  public HttpAuthorityTransport(AuthorityProperties properties) {
    this(RestClient.builder().requestFactory(requestFactory(properties)), properties.endpoint());
  }

  HttpAuthorityTransport(RestClient.Builder builder, String endpoint) {
    this.restClient = builder.baseUrl(endpoint).build();
  }

  @Override
  public String exchange(String operation, String envelope) {
    log.debug("Calling authority operation {}", operation);
    var contentType =
        MediaType.parseMediaType(
            "application/soap+xml; charset=utf-8; action=\""
                + SoapEnvelopeWriter.SERVICE_NAMESPACE
                + operation
                + "\"");
    return restClient
        .post()
        .contentType(contentType)
        .body(envelope)
        .exchange(
            (request, response) -> {
              HttpStatusCode status = response.getStatusCode();
              String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
              if (status.isError()) {
                if (body.isBlank()) {
                  throw new AuthorityProtocolException(
                      "HTTP " + status.value() + " from " + operation + " with no body");
                }
                log.warn("Authority answered {} with HTTP {}", operation, status.value());
              }
              return body;
            });
  }

  private static SimpleClientHttpRequestFactory requestFactory(AuthorityProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.requestTimeout());
    requestFactory.setReadTimeout(properties.requestTimeout());
    return requestFactory;
  }
}
