package org.medquery.controllers;

import lombok.RequiredArgsConstructor;
import org.medquery.models.dto.TablePageDTO;
import org.medquery.models.enums.Role;
import org.medquery.security.RequiresRole;
import org.medquery.service.TableBrowseService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/database/tables")
@RequiredArgsConstructor
@RequiresRole({Role.DOCTOR, Role.ADMIN})
public class DatabaseController {

    private final TableBrowseService tableBrowseService;

    @GetMapping
    public List<String> listTables() {
        return tableBrowseService.tableNames();
    }

    @GetMapping("/{tableName}")
    public TablePageDTO getTableData(@PathVariable String tableName,
                                     @RequestParam(defaultValue = "1") int page,
                                     @RequestParam(defaultValue = "10") int limit) {
        return tableBrowseService.browse(tableName, page, limit);
    }
}
