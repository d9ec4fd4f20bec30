package org.distributed.agentmesh.gossip;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one exchange with one target.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExchangeResult {
    String target;
    boolean success;
    String error;
    int peersSent;
    int peersReceived;
    @Builder.Default
    List<String> newPeers = new ArrayList<>();

    public static ExchangeResult failed(String target, String error) {
        return ExchangeResult.builder().target(target).success(false).error(error).build();
    }
}
