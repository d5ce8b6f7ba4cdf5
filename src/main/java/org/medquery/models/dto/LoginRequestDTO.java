package org.medquery.models.dto;

public record LoginRequestDTO(
        String username,
        String password
) {
}
