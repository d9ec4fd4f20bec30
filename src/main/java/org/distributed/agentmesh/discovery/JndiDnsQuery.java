package org.distributed.agentmesh.discovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Hashtable;
import java.util.List;

import javax.naming.Context;
import javax.naming.NameNotFoundException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;

import lombok.extern.slf4j.Slf4j;

/**
 * Queries one name server through the JDK's JNDI DNS provider.
 */
@Slf4j
public class JndiDnsQuery implements DnsQuery {

    private final Hashtable<String, String> environment = new Hashtable<>();

    public JndiDnsQuery(String server, int port, int timeoutMs) {
        environment.put(Context.INITIAL_CONTEXT_FACTORY, "com.sun.jndi.dns.DnsContextFactory");
        environment.put(Context.PROVIDER_URL, "dns://" + server + ":" + port);
        environment.put("com.sun.jndi.dns.timeout.initial", String.valueOf(timeoutMs));
        environment.put("com.sun.jndi.dns.timeout.retries", "1");
        log.info("[DNS] Initialized DNS resolver with nameserver: {}:{}", server, port);
    }

    @Override
    public List<String> lookup(String name, String recordType) throws NamingException {
        DirContext context = new InitialDirContext(environment);
        try {
            Attributes attributes = context.getAttributes(name, new String[]{recordType});
            Attribute attribute = attributes.get(recordType);
            if (attribute == null) {
                return Collections.emptyList();
            }
            List<String> values = new ArrayList<>();
            NamingEnumeration<?> all = attribute.getAll();
            while (all.hasMore()) {
                values.add(String.valueOf(all.next()));
            }
            return values;
        } catch (NameNotFoundException e) {
            log.debug("[DNS] No {} record for {}", recordType, name);
            return Collections.emptyList();
        } finally {
            context.close();
        }
    }
}
