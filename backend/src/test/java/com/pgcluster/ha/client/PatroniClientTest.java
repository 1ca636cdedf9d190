package com.pgcluster.ha.client;

import com.pgcluster.ha.command.CommandRunner;
import com.pgcluster.ha.command.CommandRunner.CommandResult;
import com.pgcluster.ha.config.ClusterProperties;
import com.pgcluster.ha.exception.CommandExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@DisplayName("PatroniClient")
@ExtendWith(MockitoExtension.class)
class PatroniClientTest {

    @Mock
    private CommandRunner commandRunner;

    private PatroniClient client;

    @BeforeEach
    void setUp() {
        client = new PatroniClient(new ClusterProperties(), commandRunner);
    }

    @Nested
    @DisplayName("findPrimaryAddress")
    class FindPrimaryAddress {

        @Test
        @DisplayName("should read the host from the leader DSN")
        void leaderDsn() {
            when(commandRunner.run(List.of("/opt/patroni/bin/patronictl", "-c", "/etc/patroni.conf", "dsn")))
                    .thenReturn(new CommandResult(0, "host=10.0.0.1 port=5432", ""));

            assertThat(client.findPrimaryAddress()).contains("10.0.0.1");
        }

        @Test
        @DisplayName("should be empty when patronictl fails")
        void commandFails() {
            when(commandRunner.run(anyList())).thenReturn(new CommandResult(1, "", "Error: no leader"));

            assertThat(client.findPrimaryAddress()).isEmpty();
        }
    }

    @Nested
    @DisplayName("parseDsn")
    class ParseDsn {

        @Test
        @DisplayName("should ignore a DSN for another port")
        void otherPort() {
            assertThat(client.parseDsn("host=10.0.0.1 port=6432")).isEmpty();
        }

        @Test
        @DisplayName("should be empty for null or unrelated output")
        void noMatch() {
            assertThat(client.parseDsn(null)).isEmpty();
            assertThat(client.parseDsn("Error: cluster has no leader")).isEmpty();
        }

        @Test
        @DisplayName("should find the host among other DSN fields")
        void extraFields() {
            assertThat(client.parseDsn("host=10.0.0.5 port=5432 sslmode=require")).contains("10.0.0.5");
        }
    }

    @Test
    @DisplayName("reinitialize should target the node's Patroni member name")
    void reinitialize() {
        when(commandRunner.run(anyList())).thenReturn(new CommandResult(0, "Success", ""));

        client.reinitialize("10.0.0.2");

        verify(commandRunner).run(List.of("/opt/patroni/bin/patronictl", "-c", "/etc/patroni.conf",
                "reinit", "--force", "postgres", "pg10_0_0_2"));
    }

    @Test
    @DisplayName("switchover should name the candidate and raise on failure")
    void switchoverFails() {
        when(commandRunner.run(anyList())).thenReturn(new CommandResult(1, "", "candidate is not healthy"));

        assertThatThrownBy(() -> client.switchover("10.0.0.3"))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessageContaining("pg10_0_0_3")
                .hasMessageContaining("candidate is not healthy");
    }
}
