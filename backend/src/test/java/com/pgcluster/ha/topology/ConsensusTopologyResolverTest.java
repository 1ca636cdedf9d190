package com.pgcluster.ha.topology;

import com.pgcluster.ha.client.ConsensusClient;
import com.pgcluster.ha.client.PatroniClient;
import com.pgcluster.ha.exception.TopologyUnavailableException;
import com.pgcluster.ha.model.status.ClusterTopology;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@DisplayName("ConsensusTopologyResolver")
@ExtendWith(MockitoExtension.class)
class ConsensusTopologyResolverTest {

    private static final String HEALTHY = "member 8e9e05c52164694d is healthy: got healthy result from https://10.0.0.1:2379\n"
            + "cluster is healthy";

    @Mock
    private ConsensusClient consensusClient;

    @Mock
    private PatroniClient patroniClient;

    @InjectMocks
    private ConsensusTopologyResolver resolver;

    private static Map<String, String> members(String... addresses) {
        Map<String, String> members = new LinkedHashMap<>();
        for (int i = 0; i < addresses.length; i++) {
            members.put(addresses[i], "id" + i);
        }
        return members;
    }

    @Test
    @DisplayName("should split etcd members into the DSN primary and replicas")
    void resolvesTopology() {
        when(consensusClient.clusterHealth()).thenReturn(HEALTHY);
        when(consensusClient.listMembers()).thenReturn(members("10.0.0.1", "10.0.0.2", "10.0.0.3"));
        when(patroniClient.findPrimaryAddress()).thenReturn(Optional.of("10.0.0.2"));

        ClusterTopology topology = resolver.resolve();

        assertThat(topology.getPrimary()).isEqualTo("10.0.0.2");
        assertThat(topology.getReplicas()).containsExactly("10.0.0.1", "10.0.0.3");
    }

    @Test
    @DisplayName("should report every member as replica when no primary is known")
    void noPrimary() {
        when(consensusClient.clusterHealth()).thenReturn(HEALTHY);
        when(consensusClient.listMembers()).thenReturn(members("10.0.0.1", "10.0.0.2"));
        when(patroniClient.findPrimaryAddress()).thenReturn(Optional.empty());

        ClusterTopology topology = resolver.resolve();

        assertThat(topology.hasPrimary()).isFalse();
        assertThat(topology.getReplicas()).containsExactly("10.0.0.1", "10.0.0.2");
    }

    @Test
    @DisplayName("should refuse to resolve when local etcd reports the cluster unavailable")
    void clusterUnavailable() {
        when(consensusClient.clusterHealth())
                .thenReturn("\ncluster may be unhealthy: failed to list members\nError: client: etcd cluster is unavailable");

        assertThatThrownBy(() -> resolver.resolve())
                .isInstanceOf(TopologyUnavailableException.class)
                .hasMessageContaining("retry this command on another DB cluster node");
        verifyNoInteractions(patroniClient);
        verify(consensusClient, never()).listMembers();
    }
}
