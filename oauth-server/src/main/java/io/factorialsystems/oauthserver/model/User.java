package io.factorialsystems.oauthserver.model;

import lombok.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString(exclude = "password")
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class User {
    private String id;
    private String username;
    private String email;
    private String password;
    private Boolean isActive;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    // Permission strings, e.g. oauth:client:register
    @Builder.Default
    private List<String> permissions = new ArrayList<>();

    public boolean hasPermission(String permission) {
        return permissions != null && permissions.contains(permission);
    }
}
