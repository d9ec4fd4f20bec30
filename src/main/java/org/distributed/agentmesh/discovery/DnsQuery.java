package org.distributed.agentmesh.discovery;

import java.util.List;

import javax.naming.NamingException;

/**
 * Raw name-service lookup: the textual values of all records of one type at one name.
 */
@FunctionalInterface
public interface DnsQuery {

    /**
     * @param name fully qualified record name, e.g. _llm-agent._tcp.agent1.agents.local
     * @param recordType SRV or TXT
     * @return record values, empty when the name has no record of that type
     */
    List<String> lookup(String name, String recordType) throws NamingException;
}
