package org.medquery.controllers;

import org.medquery.models.dto.LoginRequestDTO;
import org.medquery.models.dto.LoginResponseDTO;
import org.medquery.service.AuthenticationService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/auth")
public class AuthenticationController {

    private final AuthenticationService authenticationService;

    public AuthenticationController(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LoginResponseDTO loginUser(@RequestBody LoginRequestDTO body) {
        return authenticationService.loginUser(body.username(), body.password());
    }

    // OAuth2 password-grant style form, as sent by generic bearer-token clients.
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public LoginResponseDTO loginForm(@RequestParam("username") String username,
                                      @RequestParam("password") String password) {
        return authenticationService.loginUser(username, password);
    }
}
