package io.clustermanager.api.handlers;

import io.clustermanager.ClusterManager;
import io.clustermanager.api.models.requests.CommissionRequest;
import io.clustermanager.api.models.responses.CommissionResponse;
import io.clustermanager.api.models.responses.ErrorResponse;
import io.clustermanager.commission.CommissionEvent;
import io.clustermanager.exceptions.ActiveJobException;
import io.clustermanager.exceptions.StatusTransitionException;
import io.clustermanager.exceptions.TopologyException;
import io.clustermanager.exceptions.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for commissioning and the job that carries it out.
 *
 * Supported operations:
 * - POST /commission/nodes - Commission nodes into a host group, runs as the active job
 * - GET /info/job/active - The active job, if any
 * - GET /info/job/last - The last finished job
 * - POST /job/active/cancel - Cancel the running job
 *
 * Only one job runs at a time: a request made while a job is active gets 409.
 */
@Slf4j
@RestController
public class CommissionHandler {

    private final ClusterManager clusterManager;

    public CommissionHandler(ClusterManager clusterManager) {
        this.clusterManager = clusterManager;
    }

    /**
     * Commission nodes.
     * POST /commission/nodes
     */
    @PostMapping("/commission/nodes")
    public ResponseEntity<Object> commissionNodes(@RequestBody CommissionRequest request) {
        try {
            log.info("Commission request for nodes {} into host group '{}'", request.getNodes(), request.getHostGroup());
            CommissionEvent event = clusterManager.commission(
                request.getNodes(), request.getExtraVars(), request.getHostGroup());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(CommissionResponse.builder()
                .acknowledged(true)
                .jobId(event.getJobId())
                .nodes(event.getNodeNames())
                .hostGroup(event.getHostGroup())
                .build());
        } catch (ActiveJobException e) {
            log.warn("Commission of {} rejected, job '{}' is active", request.getNodes(), e.getActiveJobDescription());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.conflict("active_job_exception", e.getMessage()));
        } catch (StatusTransitionException e) {
            log.warn("Commission of {} rejected: {}", request.getNodes(), e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.conflict("status_transition_exception", e.getMessage()));
        } catch (ValidationException e) {
            log.warn("Invalid commission request for {}: {}", request.getNodes(), e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest("validation_exception", e.getMessage()));
        } catch (TopologyException e) {
            log.warn("Invalid topology for {}: {}", request.getNodes(), e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest("topology_exception", e.getMessage()));
        } catch (Exception e) {
            log.error("Error commissioning nodes {}: {}", request.getNodes(), e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Get the active job.
     * GET /info/job/active
     */
    @GetMapping("/info/job/active")
    public ResponseEntity<Object> getActiveJob() {
        return clusterManager.getActiveJob()
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Active job")));
    }

    /**
     * Get the last finished job.
     * GET /info/job/last
     */
    @GetMapping("/info/job/last")
    public ResponseEntity<Object> getLastJob() {
        return clusterManager.getLastJob()
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Last job")));
    }

    /**
     * Cancel the running job. The job ends ERRORED and its nodes are rolled back.
     * POST /job/active/cancel
     */
    @PostMapping("/job/active/cancel")
    public ResponseEntity<Object> cancelActiveJob() {
        log.info("Cancel request for the active job");
        if (!clusterManager.cancelActiveJob()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Running job"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }
}
