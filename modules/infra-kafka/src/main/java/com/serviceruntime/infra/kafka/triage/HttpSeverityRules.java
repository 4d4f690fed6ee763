package com.serviceruntime.infra.kafka.triage;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

// Loaded only when Spring Web is present.
final class HttpSeverityRules {
  private HttpSeverityRules() {}

  static Severity classify(Throwable error) {
    if (error instanceof RestClientResponseException response) {
      return response.getStatusCode().is5xxServerError()
          ? Severity.PERMANENT
          : Severity.TRANSIENT;
    }
    if (error instanceof ResourceAccessException) {
      return Severity.TRANSIENT;
    }
    if (error instanceof RestClientException) {
      return Severity.TRANSIENT;
    }
    return null;
  }
}
