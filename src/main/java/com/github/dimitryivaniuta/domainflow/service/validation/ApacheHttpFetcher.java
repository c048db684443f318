package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.config.HttpClientConfig;
import com.github.dimitryivaniuta.domainflow.domain.Proxy;
import com.github.dimitryivaniuta.domainflow.domain.ProxyProtocol;
import com.github.dimitryivaniuta.domainflow.service.error.TransportException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.HttpHostConnectException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.client5.http.protocol.RedirectLocations;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.net.NamedEndpoint;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * {@link HttpFetcher} on Apache HttpClient 5.
 *
 * <p>The request timeout is a wall-clock deadline for the whole exchange, body included: a
 * watchdog cancels the request when it runs out. Failures are reported as resource faults only when
 * the proxy itself could not be reached or refused the handshake.</p>
 */
@Component
public class ApacheHttpFetcher implements HttpFetcher, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ApacheHttpFetcher.class);

    private static final List<String> SOCKS_TARGET_REPLIES = List.of(
            "socks: connection refused",
            "socks: host unreachable",
            "socks: network unreachable",
            "socks: ttl expired");

    private final CloseableHttpClient httpClient;
    private final ScheduledThreadPoolExecutor watchdog;

    public ApacheHttpFetcher(CloseableHttpClient validationHttpClient) {
        this.httpClient = validationHttpClient;
        CustomizableThreadFactory threads = new CustomizableThreadFactory("http-deadline-");
        threads.setDaemon(true);
        this.watchdog = new ScheduledThreadPoolExecutor(1, threads);
        this.watchdog.setRemoveOnCancelPolicy(true);
    }

    @Override
    public FetchResult fetch(FetchRequest request) {
        long timeoutMs = Math.max(1L, request.timeout().toMillis());
        Timeout timeout = Timeout.ofMilliseconds(timeoutMs);
        RequestConfig.Builder config = RequestConfig.custom()
                .setConnectTimeout(timeout)
                .setResponseTimeout(timeout)
                .setConnectionRequestTimeout(timeout)
                .setRedirectsEnabled(request.followRedirects())
                .setMaxRedirects(request.maxRedirects())
                .setCircularRedirectsAllowed(false);

        HttpClientContext context = HttpClientContext.create();
        Proxy proxy = request.proxy();
        if (proxy != null) {
            if (proxy.getProtocol() == ProxyProtocol.SOCKS5) {
                context.setAttribute(HttpClientConfig.SOCKS_PROXY_ATTRIBUTE, new InetSocketAddress(proxy.host(), proxy.port()));
            } else {
                String scheme = proxy.getProtocol() == ProxyProtocol.HTTPS ? "https" : "http";
                config.setProxy(new HttpHost(scheme, proxy.host(), proxy.port()));
            }
        }

        HttpGet get;
        try {
            get = new HttpGet(request.url());
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid request to " + request.url() + ": " + e.getMessage(), false, false, e);
        }
        get.setConfig(config.build());
        request.headers().forEach(get::setHeader);
        if (request.userAgent() != null && !request.userAgent().isBlank()) {
            get.setHeader("User-Agent", request.userAgent());
        }

        AtomicBoolean expired = new AtomicBoolean();
        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        ScheduledFuture<?> deadline = watchdog.schedule(() -> {
            expired.set(true);
            get.cancel();
        }, timeoutMs, TimeUnit.MILLISECONDS);
        try {
            return httpClient.execute(get, context, response -> {
                HttpEntity entity = response.getEntity();
                byte[] body = new byte[0];
                Charset charset = StandardCharsets.UTF_8;
                long contentLength = 0L;
                if (entity != null) {
                    InputStream in = entity.getContent();
                    boolean truncated = false;
                    try {
                        body = readBounded(in, request.maxBodyBytes(), deadlineNanos);
                        truncated = body.length >= request.maxBodyBytes();
                        if (truncated) {
                            // drop the rest with the connection rather than draining it
                            get.cancel();
                        }
                    } finally {
                        closeBody(in, truncated);
                    }
                    ContentType contentType = ContentType.parseLenient(entity.getContentType());
                    if (contentType != null && contentType.getCharset() != null) {
                        charset = contentType.getCharset();
                    }
                    contentLength = entity.getContentLength() >= 0 ? entity.getContentLength() : body.length;
                }
                RedirectLocations redirects = context.getRedirectLocations();
                int redirectCount = redirects == null ? 0 : redirects.size();
                URI last = redirectCount == 0 ? null : redirects.get(redirectCount - 1);
                String finalUrl = last == null ? request.url() : last.toString();
                return new FetchResult(response.getCode(), finalUrl, redirectCount, new String(body, charset), contentLength);
            });
        } catch (IOException | RuntimeException e) {
            throw translate(request, e, expired.get());
        } finally {
            deadline.cancel(false);
        }
    }

    private static void closeBody(InputStream in, boolean connectionDropped) throws IOException {
        try {
            in.close();
        } catch (IOException e) {
            if (!connectionDropped) {
                throw e;
            }
            log.debug("Ignoring close failure of a truncated body: {}", e.getMessage());
        }
    }

    private static TransportException translate(FetchRequest request, Exception e, boolean expired) {
        if (expired) {
            return new TransportException("HTTP request to " + request.url() + " exceeded "
                    + request.timeout().toMillis() + "ms", true, false, e);
        }
        boolean resourceFault = isResourceFault(e, request.proxy());
        if (e instanceof InterruptedIOException) {
            return new TransportException("HTTP request to " + request.url() + " timed out: " + e.getMessage(), true, resourceFault, e);
        }
        return new TransportException("HTTP request to " + request.url() + " failed: " + e.getMessage(), false, resourceFault, e);
    }

    /**
     * Whether a failed exchange is the proxy's fault rather than the target's. Without a proxy the
     * target is always to blame.
     */
    static boolean isResourceFault(Throwable error, Proxy proxy) {
        if (proxy == null) {
            return false;
        }
        String proxyHost = proxy.host().toLowerCase(Locale.ROOT);
        for (Throwable t = error; t != null; t = t.getCause()) {
            NamedEndpoint endpoint = null;
            if (t instanceof HttpHostConnectException c) {
                endpoint = c.getHost();
            } else if (t instanceof ConnectTimeoutException c) {
                endpoint = c.getHost();
            }
            if (endpoint != null) {
                return proxyHost.equalsIgnoreCase(endpoint.getHostName());
            }
            String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (t instanceof UnknownHostException) {
                return message.startsWith(proxyHost);
            }
            if (message.contains("refused by proxy") || message.contains("proxy authentication")) {
                return true;
            }
            if (proxy.getProtocol() == ProxyProtocol.SOCKS5 && t instanceof SocketException) {
                if (message.contains("socks")) {
                    return SOCKS_TARGET_REPLIES.stream().noneMatch(message::startsWith);
                }
                // the JDK SOCKS socket rethrows failures to reach the proxy as a bare SocketException
                return t.getClass() == SocketException.class;
            }
        }
        return false;
    }

    static byte[] readBounded(InputStream in, int maxBytes, long deadlineNanos) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(maxBytes, 64 * 1024));
        byte[] buf = new byte[8192];
        int remaining = maxBytes;
        int n;
        while (remaining > 0 && (n = in.read(buf, 0, Math.min(buf.length, remaining))) != -1) {
            out.write(buf, 0, n);
            remaining -= n;
            if (System.nanoTime() - deadlineNanos > 0) {
                throw new InterruptedIOException("Response body not complete before the deadline");
            }
        }
        return out.toByteArray();
    }

    @Override
    public void destroy() {
        watchdog.shutdownNow();
    }
}
