package com.policyparser.discovery.api;

import com.policyparser.discovery.domain.DomainModels;
import com.policyparser.discovery.queue.DiscoveryQueueService;
import com.policyparser.discovery.queue.QueueModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/queue")
public class QueueController {
    private final DiscoveryQueueService queueService;

    public QueueController(DiscoveryQueueService queueService) {
        this.queueService = queueService;
    }

    @PostMapping("/domains")
    public ResponseEntity<QueueModels.AddDomainsResponse> addDomains(@RequestBody QueueModels.AddDomainsRequest request) {
        return ResponseEntity.ok(queueService.addDomains(request == null ? null : request.domains()));
    }

    @PostMapping("/process-next")
    public ResponseEntity<QueueModels.ProcessOutcome> processNext() {
        return ResponseEntity.ok(queueService.processNext());
    }

    @GetMapping("/status")
    public ResponseEntity<QueueModels.QueueStatus> status() {
        return ResponseEntity.ok(queueService.getStatus());
    }

    @GetMapping("/{domain}")
    public ResponseEntity<DomainModels.DiscoveryJob> job(@PathVariable String domain) {
        return queueService.find(domain)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{domain}")
    public ResponseEntity<QueueModels.ClearResult> clear(@PathVariable String domain) {
        return ResponseEntity.ok(queueService.clearCache(domain));
    }
}
