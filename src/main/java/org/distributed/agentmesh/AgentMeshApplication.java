package org.distributed.agentmesh;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class AgentMeshApplication {

    public static void main(String[] args) {

        // To run a second node locally with its own identity
        // run "mvn spring-boot:run -Dspring-boot.run.arguments="--agent.id=agent2.agents.local --server.port=8001""
        SpringApplication.run(AgentMeshApplication.class, args);
    }

}
