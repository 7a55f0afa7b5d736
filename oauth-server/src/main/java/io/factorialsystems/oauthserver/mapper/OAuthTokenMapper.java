package io.factorialsystems.oauthserver.mapper;

import io.factorialsystems.oauthserver.model.OAuthToken;
import io.factorialsystems.oauthserver.typehandler.StringListTypeHandler;
import org.apache.ibatis.annotations.*;

import java.time.OffsetDateTime;

@Mapper
public interface OAuthTokenMapper {

    @Insert("""
        INSERT INTO oauth_tokens (
            id, token_hash, token_type, client_id, user_id, scopes, family_id,
            authorization_code_id, rotated_from_id, issued_at, expires_at
        ) VALUES (
            #{id}, #{tokenHash}, #{tokenType}, #{clientId}, #{userId},
            #{scopes,typeHandler=io.factorialsystems.oauthserver.typehandler.StringListTypeHandler},
            #{familyId}, #{authorizationCodeId}, #{rotatedFromId}, #{issuedAt}, #{expiresAt}
        )
        """)
    int insert(OAuthToken token);

    @Select("""
        SELECT id, token_hash, token_type, client_id, user_id, scopes, family_id, authorization_code_id,
               rotated_from_id, rotated_to_id, issued_at, expires_at, revoked_at, rotated_at
        FROM oauth_tokens
        WHERE token_hash = #{tokenHash}
        """)
    @Results({
        @Result(property = "id", column = "id"),
        @Result(property = "tokenHash", column = "token_hash"),
        @Result(property = "tokenType", column = "token_type"),
        @Result(property = "clientId", column = "client_id"),
        @Result(property = "userId", column = "user_id"),
        @Result(property = "scopes", column = "scopes", typeHandler = StringListTypeHandler.class),
        @Result(property = "familyId", column = "family_id"),
        @Result(property = "authorizationCodeId", column = "authorization_code_id"),
        @Result(property = "rotatedFromId", column = "rotated_from_id"),
        @Result(property = "rotatedToId", column = "rotated_to_id"),
        @Result(property = "issuedAt", column = "issued_at"),
        @Result(property = "expiresAt", column = "expires_at"),
        @Result(property = "revokedAt", column = "revoked_at"),
        @Result(property = "rotatedAt", column = "rotated_at")
    })
    OAuthToken findByTokenHash(@Param("tokenHash") String tokenHash);

    /**
     * Compare-and-set on a live refresh token. A zero update count means another request
     * rotated or revoked it first.
     */
    @Update("""
        UPDATE oauth_tokens
        SET rotated_at = #{now}, revoked_at = #{now}
        WHERE id = #{id}
          AND token_type = 'REFRESH_TOKEN'
          AND rotated_at IS NULL
          AND revoked_at IS NULL
          AND expires_at > #{now}
        """)
    int markRotated(@Param("id") String id, @Param("now") OffsetDateTime now);

    @Update("""
        UPDATE oauth_tokens
        SET rotated_to_id = #{rotatedToId}
        WHERE id = #{id}
        """)
    int linkRotation(@Param("id") String id, @Param("rotatedToId") String rotatedToId);

    @Update("""
        UPDATE oauth_tokens
        SET revoked_at = #{now}
        WHERE id = #{id} AND revoked_at IS NULL
        """)
    int revoke(@Param("id") String id, @Param("now") OffsetDateTime now);

    @Update("""
        UPDATE oauth_tokens
        SET revoked_at = #{now}
        WHERE family_id = #{familyId} AND revoked_at IS NULL
        """)
    int revokeFamily(@Param("familyId") String familyId, @Param("now") OffsetDateTime now);

    @Update("""
        UPDATE oauth_tokens
        SET revoked_at = #{now}
        WHERE authorization_code_id = #{authorizationCodeId} AND revoked_at IS NULL
        """)
    int revokeByAuthorizationCode(@Param("authorizationCodeId") String authorizationCodeId,
                                  @Param("now") OffsetDateTime now);

    @Update("""
        UPDATE oauth_tokens
        SET revoked_at = #{now}
        WHERE client_id = #{clientId} AND revoked_at IS NULL
        """)
    int revokeByClient(@Param("clientId") String clientId, @Param("now") OffsetDateTime now);

    @Update("""
        UPDATE oauth_tokens
        SET revoked_at = #{now}
        WHERE revoked_at IS NULL AND expires_at <= #{now}
        """)
    int retireExpired(@Param("now") OffsetDateTime now);

    @Delete("""
        DELETE FROM oauth_tokens
        WHERE expires_at < #{cutoff} AND revoked_at IS NOT NULL
        """)
    int deleteExpired(@Param("cutoff") OffsetDateTime cutoff);
}
