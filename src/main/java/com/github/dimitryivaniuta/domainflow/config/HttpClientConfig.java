package com.github.dimitryivaniuta.domainflow.config;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.Socket;
import java.security.GeneralSecurityException;
import javax.net.ssl.SSLContext;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.socket.ConnectionSocketFactory;
import org.apache.hc.client5.http.socket.PlainConnectionSocketFactory;
import org.apache.hc.client5.http.ssl.HttpsSupport;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactory;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.http.config.Registry;
import org.apache.hc.core5.http.config.RegistryBuilder;
import org.apache.hc.core5.http.protocol.HttpContext;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Apache HttpClient used for HTTP keyword validation and proxy health probes.
 *
 * <p>Timeouts and redirect limits are set per request from the campaign and persona. HTTP proxies
 * are routed through the request config; SOCKS proxies are picked up by the socket factories below
 * from the {@link #SOCKS_PROXY_ATTRIBUTE} context attribute.</p>
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    /**
     * Context attribute holding the {@link InetSocketAddress} of a SOCKS proxy.
     */
    public static final String SOCKS_PROXY_ATTRIBUTE = "domainflow.socks.address";

    private static final int MAX_CONNECTIONS = 200;
    private static final int MAX_CONNECTIONS_PER_ROUTE = 20;

    /**
     * Pooled client shared by all validation workers.
     *
     * @param props application properties
     * @return http client
     * @throws GeneralSecurityException when the permissive SSL context cannot be built
     */
    @Bean(destroyMethod = "close")
    public CloseableHttpClient validationHttpClient(AppProperties props) throws GeneralSecurityException {
        boolean insecure = props.getValidation().isAllowInsecureTls();
        SSLContext sslContext = insecure
                ? SSLContexts.custom().loadTrustMaterial(TrustAllStrategy.INSTANCE).build()
                : SSLContexts.createSystemDefault();

        Registry<ConnectionSocketFactory> registry = RegistryBuilder.<ConnectionSocketFactory>create()
                .register("http", new SocksAwarePlainSocketFactory())
                .register("https", new SocksAwareSslSocketFactory(sslContext, insecure))
                .build();

        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager(registry);
        connectionManager.setMaxTotal(MAX_CONNECTIONS);
        connectionManager.setDefaultMaxPerRoute(MAX_CONNECTIONS_PER_ROUTE);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofSeconds(10))
                .setSocketTimeout(Timeout.ofSeconds(30))
                .build());

        log.info("Validation HttpClient configured maxTotal={} maxPerRoute={} insecureTls={}",
                MAX_CONNECTIONS, MAX_CONNECTIONS_PER_ROUTE, insecure);

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setUserAgent(props.getValidation().getDefaultUserAgent())
                .setConnectionReuseStrategy((request, response, context) -> context.getAttribute(SOCKS_PROXY_ATTRIBUTE) == null)
                .build();
    }

    private static Socket socksSocket(HttpContext context) {
        Object address = context == null ? null : context.getAttribute(SOCKS_PROXY_ATTRIBUTE);
        if (address instanceof InetSocketAddress socks) {
            return new Socket(new Proxy(Proxy.Type.SOCKS, socks));
        }
        return null;
    }

    static final class SocksAwarePlainSocketFactory extends PlainConnectionSocketFactory {
        @Override
        public Socket createSocket(HttpContext context) throws IOException {
            Socket socket = socksSocket(context);
            return socket != null ? socket : super.createSocket(context);
        }
    }

    static final class SocksAwareSslSocketFactory extends SSLConnectionSocketFactory {
        SocksAwareSslSocketFactory(SSLContext sslContext, boolean insecure) {
            super(sslContext, insecure ? NoopHostnameVerifier.INSTANCE : HttpsSupport.getDefaultHostnameVerifier());
        }

        @Override
        public Socket createSocket(HttpContext context) throws IOException {
            Socket socket = socksSocket(context);
            return socket != null ? socket : super.createSocket(context);
        }
    }
}
