package org.distributed.agentmesh.discovery;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.distributed.agentmesh.model.AgentRecord;
import org.distributed.agentmesh.model.Provenance;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves an agent id through its SRV and TXT records.
 *
 * SRV  _llm-agent._tcp.agent1.agents.local -> "0 5 8000 agent1.agents.local."
 * TXT  _llm-agent._tcp.agent1.agents.local -> "caps=chat,translation" "desc=General agent" "ver=0.1.0"
 *
 * The name service cannot enumerate agents, only single ids are supported.
 */
@Slf4j
public class DnsLink {

    public static final String SERVICE_PREFIX = "_llm-agent._tcp.";
    static final String DEFAULT_VERSION = "1.0";

    private static final List<String> TXT_KEYS = Arrays.asList("caps=", "desc=", "ver=");

    private final DnsQuery dnsQuery;

    public DnsLink(DnsQuery dnsQuery) {
        this.dnsQuery = dnsQuery;
    }

    /**
     * @return the agent described by the records, empty when there is no SRV record or the lookup failed
     */
    public Optional<AgentRecord> resolve(String agentId) {
        String serviceName = SERVICE_PREFIX + agentId;
        try {
            List<String> srvRecords = dnsQuery.lookup(serviceName, "SRV");
            if (srvRecords.isEmpty()) {
                log.warn("[DNS] No SRV record found for {}", agentId);
                return Optional.empty();
            }
            String[] srv = srvRecords.get(0).trim().split("\\s+");
            if (srv.length < 4) {
                log.warn("[DNS] Malformed SRV record for {}: {}", agentId, srvRecords.get(0));
                return Optional.empty();
            }
            String port = srv[2];
            String host = stripTrailingDot(srv[3]);

            List<String> capabilities = new ArrayList<>();
            String description = "";
            String version = DEFAULT_VERSION;
            for (String txt : dnsQuery.lookup(serviceName, "TXT")) {
                for (String token : txtTokens(txt)) {
                    if (token.startsWith("caps=")) {
                        for (String capability : token.substring(5).split(",")) {
                            if (!capability.isBlank()) {
                                capabilities.add(capability.trim());
                            }
                        }
                    } else if (token.startsWith("desc=")) {
                        description = token.substring(5);
                    } else if (token.startsWith("ver=")) {
                        version = token.substring(4);
                    }
                }
            }

            return Optional.of(AgentRecord.builder()
                    .id(agentId)
                    .host(host)
                    .port(port)
                    .capabilities(capabilities)
                    .description(description)
                    .version(version)
                    .provenance(Provenance.DNS)
                    .build());
        } catch (Exception e) {
            log.error("[DNS] Error resolving agent {}: {}", agentId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Splits a TXT value into its key=value tokens. Quoted character-strings are
     * taken whole; an unquoted word that does not start a known key belongs to
     * the previous token (descriptions carry spaces).
     */
    static List<String> txtTokens(String value) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '"') {
                StringBuilder quoted = new StringBuilder();
                i++;
                while (i < value.length() && value.charAt(i) != '"') {
                    if (value.charAt(i) == '\\' && i + 1 < value.length()) {
                        i++;
                    }
                    quoted.append(value.charAt(i));
                    i++;
                }
                i++;
                tokens.add(quoted.toString());
            } else {
                int end = i;
                while (end < value.length() && !Character.isWhitespace(value.charAt(end))) {
                    end++;
                }
                String word = value.substring(i, end);
                if (!tokens.isEmpty() && TXT_KEYS.stream().noneMatch(word::startsWith)) {
                    tokens.set(tokens.size() - 1, tokens.get(tokens.size() - 1) + " " + word);
                } else {
                    tokens.add(word);
                }
                i = end;
            }
        }
        return tokens;
    }

    private static String stripTrailingDot(String host) {
        return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    }
}
