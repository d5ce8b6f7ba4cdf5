package org.medquery.controllers;

import lombok.RequiredArgsConstructor;
import org.medquery.models.dto.AuditSummaryDTO;
import org.medquery.models.dto.IngestionRequestDTO;
import org.medquery.models.dto.QueryHistoryItemDTO;
import org.medquery.models.enums.Role;
import org.medquery.security.AccessGateInterceptor;
import org.medquery.security.Principal;
import org.medquery.security.RequiresRole;
import org.medquery.service.AuditService;
import org.medquery.service.ingestion.IngestionPipeline;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/audit")
@RequiredArgsConstructor
@RequiresRole(Role.ADMIN)
public class AuditController {

    private final AuditService auditService;
    private final IngestionPipeline ingestionPipeline;

    @GetMapping("/summary")
    public AuditSummaryDTO getAuditSummary() {
        return auditService.summary();
    }

    @GetMapping("/logs")
    public List<QueryHistoryItemDTO> getAuditLogs(@RequestParam(defaultValue = "50") int limit) {
        return auditService.recentQueries(limit);
    }

    @GetMapping("/pending-uploads")
    public List<IngestionRequestDTO> getPendingUploads() {
        return ingestionPipeline.listPending();
    }

    @PostMapping("/upload/{requestId}/approve")
    public IngestionRequestDTO approveUpload(@PathVariable Long requestId,
                                             @RequestAttribute(AccessGateInterceptor.PRINCIPAL_ATTRIBUTE) Principal principal) {
        return ingestionPipeline.approve(requestId, principal);
    }

    @PostMapping("/upload/{requestId}/reject")
    public IngestionRequestDTO rejectUpload(@PathVariable Long requestId,
                                            @RequestAttribute(AccessGateInterceptor.PRINCIPAL_ATTRIBUTE) Principal principal) {
        return ingestionPipeline.reject(requestId, principal);
    }
}
