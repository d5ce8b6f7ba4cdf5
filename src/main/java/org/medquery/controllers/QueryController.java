package org.medquery.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.medquery.models.dto.QueryRequest;
import org.medquery.models.dto.QueryResponse;
import org.medquery.models.enums.Role;
import org.medquery.security.AccessGateInterceptor;
import org.medquery.security.Principal;
import org.medquery.security.RequiresRole;
import org.medquery.service.query.QueryPipeline;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/query")
@RequiredArgsConstructor
@RequiresRole({Role.DOCTOR, Role.ADMIN})
public class QueryController {

    private final QueryPipeline queryPipeline;

    @PostMapping
    public QueryResponse processQuery(@RequestBody QueryRequest request,
                                      @RequestAttribute(AccessGateInterceptor.PRINCIPAL_ATTRIBUTE) Principal principal) {
        log.info("Query request from {} (planOnly={})", principal.subject(), request.planOnly());
        return queryPipeline.run(principal, request);
    }
}
