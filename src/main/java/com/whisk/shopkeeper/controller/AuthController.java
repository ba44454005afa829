package com.whisk.shopkeeper.controller;

import com.whisk.shopkeeper.dto.ApiError;
import com.whisk.shopkeeper.dto.TokenResponse;
import com.whisk.shopkeeper.exception.ErrorKind;
import com.whisk.shopkeeper.service.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@Slf4j
public class AuthController {

    private final AuthenticationManager authenticationManager;
    private final TokenService tokenService;

    public AuthController(AuthenticationManager authenticationManager, TokenService tokenService) {
        this.authenticationManager = authenticationManager;
        this.tokenService = tokenService;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Welcome to Whisk & Whisk Pastry Shop API");
    }

    // OAuth2 password-style form: username + password
    @PostMapping(value = "/api/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<?> token(@RequestParam String username, @RequestParam String password) {
        Authentication authentication;
        try {
            authentication = authenticationManager.authenticate(
                    UsernamePasswordAuthenticationToken.unauthenticated(username, password));
        } catch (AuthenticationException e) {
            log.warn("Login failed for {}", username);
            ApiError error = ApiError.builder()
                    .kind(ErrorKind.UNAUTHENTICATED)
                    .error("Unauthenticated")
                    .message("Incorrect username or password")
                    .timestamp(Instant.now())
                    .build();
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                    .body(error);
        }

        String token = tokenService.issue(authentication.getName());
        log.info("Issued access token for {}", authentication.getName());
        return ResponseEntity.ok(TokenResponse.bearer(token));
    }
}
