package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.domain.persona.DnsPersonaConfig;
import com.github.dimitryivaniuta.domainflow.service.error.TransportException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.List;
import java.util.stream.Collectors;
import javax.naming.CommunicationException;
import javax.naming.Context;
import javax.naming.NameNotFoundException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link DnsResolver} on the JDK's JNDI DNS provider.
 *
 * <p>Queries go to the persona's resolvers in order; a persona without resolvers uses the platform's
 * configured servers.</p>
 */
@Component
public class JndiDnsResolver implements DnsResolver {

    private static final Logger log = LoggerFactory.getLogger(JndiDnsResolver.class);

    static final String DNS_CONTEXT_FACTORY = "com.sun.jndi.dns.DnsContextFactory";

    @Override
    public DnsLookup lookup(String domain, DnsPersonaConfig persona, Duration timeout) {
        String providerUrl = providerUrl(persona);
        Hashtable<String, String> env = new Hashtable<>();
        env.put(Context.INITIAL_CONTEXT_FACTORY, DNS_CONTEXT_FACTORY);
        env.put(Context.PROVIDER_URL, providerUrl);
        env.put("com.sun.jndi.dns.timeout.initial", String.valueOf(Math.max(1L, timeout.toMillis())));
        env.put("com.sun.jndi.dns.timeout.retries", "1");

        DirContext ctx = null;
        try {
            ctx = new InitialDirContext(env);
            Attributes attrs = ctx.getAttributes(domain, persona.recordTypes().toArray(new String[0]));
            List<String> addresses = new ArrayList<>();
            for (String type : persona.recordTypes()) {
                Attribute attr = attrs.get(type);
                if (attr == null) {
                    continue;
                }
                NamingEnumeration<?> values = attr.getAll();
                while (values.hasMore()) {
                    addresses.add(String.valueOf(values.next()));
                }
            }
            return new DnsLookup(!addresses.isEmpty(), addresses, providerUrl);
        } catch (NameNotFoundException e) {
            return new DnsLookup(false, List.of(), providerUrl);
        } catch (NamingException e) {
            boolean timedOut = e instanceof CommunicationException && e.getRootCause() instanceof SocketTimeoutException;
            throw new TransportException("DNS lookup of " + domain + " via " + providerUrl + " failed: " + e.getMessage(), timedOut, e);
        } finally {
            if (ctx != null) {
                try {
                    ctx.close();
                } catch (NamingException e) {
                    log.debug("Closing DNS context failed: {}", e.getMessage());
                }
            }
        }
    }

    static String providerUrl(DnsPersonaConfig persona) {
        if (persona.resolvers().isEmpty()) {
            return "dns:";
        }
        return persona.resolvers().stream()
                .map(String::trim)
                .map(r -> "dns://" + r)
                .collect(Collectors.joining(" "));
    }
}
