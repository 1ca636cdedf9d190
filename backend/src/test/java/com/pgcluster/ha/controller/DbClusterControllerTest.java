package com.pgcluster.ha.controller;

import com.pgcluster.ha.exception.AlreadyMemberException;
import com.pgcluster.ha.exception.LastReplicaException;
import com.pgcluster.ha.exception.TopologyUnavailableException;
import com.pgcluster.ha.model.dto.MembershipResult;
import com.pgcluster.ha.model.status.ClusterHealth;
import com.pgcluster.ha.model.status.ClusterVerdict;
import com.pgcluster.ha.model.status.ConsensusRole;
import com.pgcluster.ha.model.status.NodeRole;
import com.pgcluster.ha.model.status.NodeStatus;
import com.pgcluster.ha.model.status.RawAgentStatus;
import com.pgcluster.ha.service.ClusterStatusService;
import com.pgcluster.ha.service.MembershipService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DbClusterController.class)
@ActiveProfiles("test")
@DisplayName("DbClusterController")
class DbClusterControllerTest {

    private static final String BASE = "/internal/db-cluster";

    @Autowired private MockMvc mockMvc;

    @MockBean private ClusterStatusService clusterStatusService;
    @MockBean private MembershipService membershipService;

    @Value("${security.internal-api-key}")
    private String internalApiKey;

    private static MembershipResult result(String operation, String address, boolean confirmed) {
        return MembershipResult.builder()
                .operation(operation)
                .address(address)
                .confirmed(confirmed)
                .message("done")
                .build();
    }

    @Nested
    @DisplayName("authentication")
    class Authentication {

        @Test
        @DisplayName("should reject requests without an API key")
        void missingKey() throws Exception {
            mockMvc.perform(get(BASE + "/status"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error", containsString("Missing API key")));
            verifyNoInteractions(clusterStatusService);
        }

        @Test
        @DisplayName("should reject a wrong API key")
        void wrongKey() throws Exception {
            mockMvc.perform(get(BASE + "/status").header("X-Internal-Api-Key", "not-the-key"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("Invalid API key"));
        }

        @Test
        @DisplayName("should accept the key as a bearer token")
        void bearerToken() throws Exception {
            when(clusterStatusService.getClusterStatus())
                    .thenReturn(ClusterVerdict.builder().status(ClusterHealth.HEALTHY).nodes(List.of()).build());

            mockMvc.perform(get(BASE + "/status").header("Authorization", "Bearer " + internalApiKey))
                    .andExpect(status().isOk());
        }
    }

    @Nested
    @DisplayName("GET /status")
    class GetStatus {

        @Test
        @DisplayName("should render the verdict with its numeric code and node rows")
        void rendersVerdict() throws Exception {
            NodeStatus primary = NodeStatus.builder()
                    .address("10.0.0.1")
                    .role(NodeRole.LEADER)
                    .alive(true)
                    .logPosition(1024L)
                    .timeline(2L)
                    .consensusRole(ConsensusRole.LEADER)
                    .rawStatus(RawAgentStatus.builder().state("running").build())
                    .build();
            NodeStatus replica = NodeStatus.builder()
                    .address("10.0.0.2")
                    .role(NodeRole.ASYNC_REPLICA)
                    .alive(true)
                    .consensusRole(ConsensusRole.FOLLOWER)
                    .build();
            replica.addError("Lag: 3.00MiB");
            when(clusterStatusService.getClusterStatus()).thenReturn(ClusterVerdict.builder()
                    .status(ClusterHealth.DEGRADED)
                    .nodes(List.of(primary, replica))
                    .diagnostics(List.of("Missing one or more etcd followers."))
                    .build());

            mockMvc.perform(get(BASE + "/status").header("X-Internal-Api-Key", internalApiKey))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("degraded"))
                    .andExpect(jsonPath("$.statusCode").value(1))
                    .andExpect(jsonPath("$.nodes", hasSize(2)))
                    .andExpect(jsonPath("$.nodes[0].role").value("leader"))
                    .andExpect(jsonPath("$.nodes[0].consensusRole").value("leader"))
                    .andExpect(jsonPath("$.nodes[0].rawStatus").doesNotExist())
                    .andExpect(jsonPath("$.nodes[1].role").value("async_replica"))
                    .andExpect(jsonPath("$.nodes[1].errors[0]").value("Lag: 3.00MiB"))
                    .andExpect(jsonPath("$.diagnostics[0]").value("Missing one or more etcd followers."));
        }

        @Test
        @DisplayName("should answer 503 when topology cannot be resolved")
        void topologyUnavailable() throws Exception {
            when(clusterStatusService.getClusterStatus())
                    .thenThrow(new TopologyUnavailableException("Etcd is not responding on this node."));

            mockMvc.perform(get(BASE + "/status").header("X-Internal-Api-Key", internalApiKey))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.code").value(TopologyUnavailableException.CODE));
        }
    }

    @Nested
    @DisplayName("membership")
    class Membership {

        @Test
        @DisplayName("POST /nodes should add the node and answer 201")
        void addNode() throws Exception {
            when(membershipService.addNode("10.0.0.4"))
                    .thenReturn(result(MembershipResult.OPERATION_ADD, "10.0.0.4", true));

            mockMvc.perform(post(BASE + "/nodes")
                            .header("X-Internal-Api-Key", internalApiKey)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"address\": \"10.0.0.4\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.operation").value("add"))
                    .andExpect(jsonPath("$.confirmed").value(true));
        }

        @Test
        @DisplayName("POST /nodes should validate the address")
        void addNodeInvalid() throws Exception {
            mockMvc.perform(post(BASE + "/nodes")
                            .header("X-Internal-Api-Key", internalApiKey)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"address\": \"\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors.address").exists());
            verifyNoInteractions(membershipService);
        }

        @Test
        @DisplayName("POST /nodes should answer 409 for an existing member")
        void addNodeConflict() throws Exception {
            when(membershipService.addNode("10.0.0.2")).thenThrow(new AlreadyMemberException("10.0.0.2"));

            mockMvc.perform(post(BASE + "/nodes")
                            .header("X-Internal-Api-Key", internalApiKey)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"address\": \"10.0.0.2\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value(AlreadyMemberException.CODE));
        }

        @Test
        @DisplayName("DELETE /nodes/{address} should remove the node")
        void removeNode() throws Exception {
            when(membershipService.removeNode("10.0.0.3"))
                    .thenReturn(result(MembershipResult.OPERATION_REMOVE, "10.0.0.3", true));

            mockMvc.perform(delete(BASE + "/nodes/10.0.0.3").header("X-Internal-Api-Key", internalApiKey))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.address").value("10.0.0.3"));
        }

        @Test
        @DisplayName("DELETE /nodes/{address} should answer 409 for the last replica")
        void removeLastReplica() throws Exception {
            when(membershipService.removeNode("10.0.0.2")).thenThrow(new LastReplicaException());

            mockMvc.perform(delete(BASE + "/nodes/10.0.0.2").header("X-Internal-Api-Key", internalApiKey))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value(LastReplicaException.CODE));
        }

        @Test
        @DisplayName("POST /nodes/{address}/reinit should answer 202")
        void reinitNode() throws Exception {
            when(membershipService.reinitNode("10.0.0.2"))
                    .thenReturn(result(MembershipResult.OPERATION_REINIT, "10.0.0.2", true));

            mockMvc.perform(post(BASE + "/nodes/10.0.0.2/reinit").header("X-Internal-Api-Key", internalApiKey))
                    .andExpect(status().isAccepted());
        }

        @Test
        @DisplayName("POST /nodes/{address}/promote should answer 200 even when unconfirmed")
        void promoteNode() throws Exception {
            when(membershipService.promoteNode("10.0.0.2"))
                    .thenReturn(result(MembershipResult.OPERATION_PROMOTE, "10.0.0.2", false));

            mockMvc.perform(post(BASE + "/nodes/10.0.0.2/promote").header("X-Internal-Api-Key", internalApiKey))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.confirmed").value(false));
        }
    }
}
