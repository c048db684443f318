package com.github.dimitryivaniuta.domainflow.service.validation;

/**
 * Response of a completed HTTP exchange.
 *
 * @param statusCode    final status code
 * @param finalUrl      URL after redirects
 * @param redirectCount redirects followed
 * @param body          decoded body, possibly truncated
 * @param contentLength declared length, or bytes read when undeclared
 */
public record FetchResult(int statusCode, String finalUrl, int redirectCount, String body, long contentLength) {
}
