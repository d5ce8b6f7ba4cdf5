package org.medquery.controllers;

import lombok.RequiredArgsConstructor;
import org.medquery.models.dto.EntitySchemaDTO;
import org.medquery.models.enums.Role;
import org.medquery.schema.SchemaRegistry;
import org.medquery.security.RequiresRole;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/schema")
@RequiredArgsConstructor
@RequiresRole({Role.DOCTOR, Role.ADMIN})
public class SchemaController {

    private final SchemaRegistry schemaRegistry;

    @GetMapping
    public List<EntitySchemaDTO> listEntities() {
        return schemaRegistry.definitions().stream()
                .map(EntitySchemaDTO::from)
                .toList();
    }

    @GetMapping("/{entityName}")
    public EntitySchemaDTO getEntity(@PathVariable String entityName) {
        return EntitySchemaDTO.from(schemaRegistry.definitionFor(entityName));
    }
}
