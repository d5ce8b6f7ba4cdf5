package org.medquery.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.medquery.models.dto.IngestionRequestDTO;
import org.medquery.models.dto.IngestionResultDTO;
import org.medquery.models.dto.SingleRecordRequest;
import org.medquery.models.enums.Role;
import org.medquery.security.AccessGateInterceptor;
import org.medquery.security.Principal;
import org.medquery.security.RequiresRole;
import org.medquery.service.ingestion.IngestionPipeline;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

/**
 * Direct endpoints integrate immediately and are admin only; the request endpoints quarantine
 * the payload for review.
 */
@Slf4j
@RestController
@RequestMapping("/upload")
@RequiredArgsConstructor
public class UploadController {

    private final IngestionPipeline ingestionPipeline;

    @PostMapping(value = "/single", consumes = MediaType.APPLICATION_JSON_VALUE)
    @RequiresRole(Role.ADMIN)
    public IngestionResultDTO createSingleRecord(@RequestBody SingleRecordRequest request,
                                                 @RequestAttribute(AccessGateInterceptor.PRINCIPAL_ATTRIBUTE) Principal principal) {
        return ingestionPipeline.ingestDirect(principal, request.targetEntity(), request.fields());
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @RequiresRole(Role.ADMIN)
    public IngestionResultDTO uploadFile(@RequestParam("file") MultipartFile file,
                                         @RequestParam("table_name") String tableName,
                                         @RequestAttribute(AccessGateInterceptor.PRINCIPAL_ATTRIBUTE) Principal principal) throws IOException {
        log.info("Received batch upload {} for {}", file.getOriginalFilename(), tableName);
        requireContent(file);
        try (InputStream content = file.getInputStream()) {
            return ingestionPipeline.ingestDirectBatch(principal, tableName, file.getOriginalFilename(), content);
        }
    }

    @PostMapping(value = "/request/single", consumes = MediaType.APPLICATION_JSON_VALUE)
    @RequiresRole({Role.DOCTOR, Role.ADMIN})
    @ResponseStatus(HttpStatus.ACCEPTED)
    public IngestionRequestDTO requestSingleRecord(@RequestBody SingleRecordRequest request,
                                                   @RequestAttribute(AccessGateInterceptor.PRINCIPAL_ATTRIBUTE) Principal principal) {
        return ingestionPipeline.requestSingle(principal, request.targetEntity(), request.fields());
    }

    @PostMapping(value = "/request", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @RequiresRole({Role.DOCTOR, Role.ADMIN})
    @ResponseStatus(HttpStatus.ACCEPTED)
    public IngestionRequestDTO requestFile(@RequestParam("file") MultipartFile file,
                                           @RequestParam("table_name") String tableName,
                                           @RequestAttribute(AccessGateInterceptor.PRINCIPAL_ATTRIBUTE) Principal principal) throws IOException {
        log.info("Received batch upload request {} for {}", file.getOriginalFilename(), tableName);
        requireContent(file);
        try (InputStream content = file.getInputStream()) {
            return ingestionPipeline.requestBatch(principal, tableName, file.getOriginalFilename(), content);
        }
    }

    private void requireContent(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is empty");
        }
    }
}
