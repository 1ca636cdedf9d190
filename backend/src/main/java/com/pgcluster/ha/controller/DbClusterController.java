package com.pgcluster.ha.controller;

import com.pgcluster.ha.model.dto.AddNodeRequest;
import com.pgcluster.ha.model.dto.ClusterStatusResponse;
import com.pgcluster.ha.model.dto.MembershipResult;
import com.pgcluster.ha.service.ClusterStatusService;
import com.pgcluster.ha.service.MembershipService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/internal/db-cluster")
@RequiredArgsConstructor
@Tag(name = "DB Cluster", description = "Database cluster status and membership")
public class DbClusterController {

    private final ClusterStatusService clusterStatusService;
    private final MembershipService membershipService;

    /**
     * GET /internal/db-cluster/status
     */
    @GetMapping("/status")
    @Operation(summary = "Get cluster health and the status of every member")
    public ResponseEntity<ClusterStatusResponse> getStatus() {
        return ResponseEntity.ok(ClusterStatusResponse.from(clusterStatusService.getClusterStatus()));
    }

    /**
     * POST /internal/db-cluster/nodes
     * Only valid on a client node; database nodes join at install time.
     */
    @PostMapping("/nodes")
    @Operation(summary = "Add a database node to this client's proxy backends")
    public ResponseEntity<MembershipResult> addNode(@Valid @RequestBody AddNodeRequest request) {
        MembershipResult result = membershipService.addNode(request.getAddress());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @DeleteMapping("/nodes/{address}")
    @Operation(summary = "Remove a replica from the cluster")
    public ResponseEntity<MembershipResult> removeNode(@PathVariable String address) {
        return ResponseEntity.ok(membershipService.removeNode(address));
    }

    /**
     * POST /internal/db-cluster/nodes/{address}/reinit
     * Accepted once Patroni has the request; the rebuild continues in the background.
     */
    @PostMapping("/nodes/{address}/reinit")
    @Operation(summary = "Reinitialise a replica from the primary")
    public ResponseEntity<MembershipResult> reinitNode(@PathVariable String address) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(membershipService.reinitNode(address));
    }

    @PostMapping("/nodes/{address}/promote")
    @Operation(summary = "Switch the primary role to a replica")
    public ResponseEntity<MembershipResult> promoteNode(@PathVariable String address) {
        return ResponseEntity.ok(membershipService.promoteNode(address));
    }
}
