package it.unimib.datai.funcorch.controlplane.api;

import it.unimib.datai.funcorch.common.model.HeartbeatRequest;
import it.unimib.datai.funcorch.common.model.HostStatus;
import it.unimib.datai.funcorch.controlplane.heartbeat.HeartbeatTracker;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/heartbeats")
public class HeartbeatController {
    private final HeartbeatTracker heartbeatTracker;

    public HeartbeatController(HeartbeatTracker heartbeatTracker) {
        this.heartbeatTracker = heartbeatTracker;
    }

    @PostMapping
    public ResponseEntity<Void> touch(@RequestBody @Valid HeartbeatRequest request) {
        heartbeatTracker.touch(request.assemblyFullName());
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    public List<HostStatus> list() {
        return heartbeatTracker.readAll().stream()
                .map(host -> new HostStatus(host.assemblyFullName(), host.lastHeartbeatUtc(),
                        heartbeatTracker.isLive(host)))
                .toList();
    }
}
