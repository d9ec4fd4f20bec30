package org.distributed.agentmesh.gossip;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GossipRoundResult {

    public static final String COMPLETED = "completed";
    public static final String NO_TARGETS = "no_targets";

    String status;
    @Builder.Default
    List<String> targets = new ArrayList<>();
    @Builder.Default
    List<ExchangeResult> results = new ArrayList<>();
    @Builder.Default
    List<String> evicted = new ArrayList<>();
    // milliseconds
    long duration;
    GossipStats stats;
}
