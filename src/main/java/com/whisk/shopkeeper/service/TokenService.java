package com.whisk.shopkeeper.service;

import com.whisk.shopkeeper.config.ShopProperties;
import com.whisk.shopkeeper.model.AccessToken;
import com.whisk.shopkeeper.repository.AccessTokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Issues opaque bearer tokens and maps them back to a principal.
 */
@Service
@Slf4j
public class TokenService {

    private static final int TOKEN_BYTES = 32;

    private final AccessTokenRepository tokenRepository;
    private final UserDetailsService userDetailsService;
    private final ShopProperties properties;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public TokenService(AccessTokenRepository tokenRepository, UserDetailsService userDetailsService,
            ShopProperties properties, Clock clock) {
        this.tokenRepository = tokenRepository;
        this.userDetailsService = userDetailsService;
        this.properties = properties;
        this.clock = clock;
    }

    public String issue(String username) {
        Instant now = clock.instant();
        int purged = tokenRepository.deleteExpired(now);
        if (purged > 0) {
            log.debug("Purged {} expired tokens", purged);
        }

        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);

        AccessToken token = new AccessToken();
        token.setToken(HexFormat.of().formatHex(bytes));
        token.setUsername(username);
        token.setIssuedAt(now);
        token.setExpiresAt(now.plus(properties.getAuth().getTokenTtl()));
        tokenRepository.save(token);
        return token.getToken();
    }

    /**
     * Empty when the token is unknown, expired, or its user no longer exists.
     */
    public Optional<Authentication> authenticate(String rawToken) {
        Optional<AccessToken> stored = tokenRepository.findByToken(rawToken);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        AccessToken token = stored.get();
        if (token.isExpired(clock.instant())) {
            log.debug("Rejected expired token for {}", token.getUsername());
            return Optional.empty();
        }
        try {
            UserDetails user = userDetailsService.loadUserByUsername(token.getUsername());
            return Optional.of(UsernamePasswordAuthenticationToken.authenticated(
                    user.getUsername(), null, user.getAuthorities()));
        } catch (UsernameNotFoundException e) {
            log.warn("Token presented for removed user {}", token.getUsername());
            return Optional.empty();
        }
    }
}
