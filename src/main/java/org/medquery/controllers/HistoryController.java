package org.medquery.controllers;

import lombok.RequiredArgsConstructor;
import org.medquery.models.dto.QueryHistoryItemDTO;
import org.medquery.models.enums.Role;
import org.medquery.security.RequiresRole;
import org.medquery.service.AuditService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/history")
@RequiredArgsConstructor
@RequiresRole({Role.DOCTOR, Role.ADMIN})
public class HistoryController {

    private final AuditService auditService;

    @GetMapping
    public List<QueryHistoryItemDTO> getRecentHistory(@RequestParam(defaultValue = "10") int limit) {
        return auditService.recentQueries(limit);
    }
}
