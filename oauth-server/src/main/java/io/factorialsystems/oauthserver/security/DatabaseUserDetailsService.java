package io.factorialsystems.oauthserver.security;

import io.factorialsystems.oauthserver.model.User;
import io.factorialsystems.oauthserver.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads platform users for the login in front of {@code /authorize} and for the HTTP Basic
 * protected registration and admin endpoints. Permissions become granted authorities.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseUserDetailsService implements UserDetailsService {

    private final UserRepository userRepository;

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        log.debug("Loading user details for username: {}", username);

        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> {
                    log.warn("User not found with username: {}", username);
                    return new UsernameNotFoundException("User not found with username: " + username);
                });

        if (!Boolean.TRUE.equals(user.getIsActive())) {
            log.warn("User account is disabled: {}", username);
            throw new UsernameNotFoundException("User account is disabled: " + username);
        }

        return new CustomUserPrincipal(user);
    }

    public record CustomUserPrincipal(User user) implements UserDetails {

        @Override
        public Collection<? extends GrantedAuthority> getAuthorities() {
            if (user.getPermissions() == null || user.getPermissions().isEmpty()) {
                return List.of();
            }
            return user.getPermissions().stream()
                    .map(SimpleGrantedAuthority::new)
                    .collect(Collectors.toList());
        }

        @Override
        public String getPassword() {
            return user.getPassword();
        }

        @Override
        public String getUsername() {
            return user.getUsername();
        }

        @Override
        public boolean isAccountNonExpired() {
            return true;
        }

        @Override
        public boolean isAccountNonLocked() {
            return true;
        }

        @Override
        public boolean isCredentialsNonExpired() {
            return true;
        }

        @Override
        public boolean isEnabled() {
            return Boolean.TRUE.equals(user.getIsActive());
        }

        public String getUserId() {
            return user.getId();
        }

        @Override
        public String toString() {
            return "CustomUserPrincipal{username='" + user.getUsername() + "', permissions="
                    + (user.getPermissions() != null ? user.getPermissions().size() : 0) + "}";
        }
    }
}
