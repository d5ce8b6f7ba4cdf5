package org.medquery.controllers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.medquery.exceptions.UnknownEntityException;
import org.medquery.models.dto.TablePageDTO;
import org.medquery.security.AccessGate;
import org.medquery.security.AccessGateInterceptor;
import org.medquery.service.TableBrowseService;
import org.medquery.support.TestTokens;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DatabaseControllerTest {

    private TableBrowseService tableBrowseService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        tableBrowseService = mock(TableBrowseService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new DatabaseController(tableBrowseService))
                .addInterceptors(new AccessGateInterceptor(new AccessGate(TestTokens.decoder())))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void browseRequiresCredential() throws Exception {
        mockMvc.perform(get("/database/tables/patients"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(tableBrowseService);
    }

    @Test
    void doctorBrowsesTablePage() throws Exception {
        when(tableBrowseService.browse("patients", 2, 3)).thenReturn(new TablePageDTO("patients",
                List.of(Map.of("subject_id", 4)), 8, 2, 3, List.of("subject_id")));

        mockMvc.perform(get("/database/tables/patients")
                        .param("page", "2")
                        .param("limit", "3")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.token("doctor", "doctor")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRows").value(8))
                .andExpect(jsonPath("$.data[0].subject_id").value(4))
                .andExpect(jsonPath("$.columns[0]").value("subject_id"));
    }

    @Test
    void unknownTableIsBadRequest() throws Exception {
        when(tableBrowseService.browse("clinical_notes", 1, 10))
                .thenThrow(new UnknownEntityException("Invalid table name: clinical_notes"));

        mockMvc.perform(get("/database/tables/clinical_notes")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.token("admin", "admin")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNKNOWN_ENTITY"));
    }
}
