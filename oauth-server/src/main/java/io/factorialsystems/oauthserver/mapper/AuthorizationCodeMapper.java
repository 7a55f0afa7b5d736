package io.factorialsystems.oauthserver.mapper;

import io.factorialsystems.oauthserver.model.AuthorizationCode;
import io.factorialsystems.oauthserver.typehandler.StringListTypeHandler;
import org.apache.ibatis.annotations.*;

import java.time.OffsetDateTime;

@Mapper
public interface AuthorizationCodeMapper {

    @Insert("""
        INSERT INTO authorization_codes (
            id, code_hash, client_id, user_id, redirect_uri, scopes,
            code_challenge, code_challenge_method, issued_at, expires_at
        ) VALUES (
            #{id}, #{codeHash}, #{clientId}, #{userId}, #{redirectUri},
            #{scopes,typeHandler=io.factorialsystems.oauthserver.typehandler.StringListTypeHandler},
            #{codeChallenge}, #{codeChallengeMethod}, #{issuedAt}, #{expiresAt}
        )
        """)
    int insert(AuthorizationCode authorizationCode);

    @Select("""
        SELECT id, code_hash, client_id, user_id, redirect_uri, scopes,
               code_challenge, code_challenge_method, issued_at, expires_at, consumed_at
        FROM authorization_codes
        WHERE code_hash = #{codeHash}
        """)
    @Results({
        @Result(property = "id", column = "id"),
        @Result(property = "codeHash", column = "code_hash"),
        @Result(property = "clientId", column = "client_id"),
        @Result(property = "userId", column = "user_id"),
        @Result(property = "redirectUri", column = "redirect_uri"),
        @Result(property = "scopes", column = "scopes", typeHandler = StringListTypeHandler.class),
        @Result(property = "codeChallenge", column = "code_challenge"),
        @Result(property = "codeChallengeMethod", column = "code_challenge_method"),
        @Result(property = "issuedAt", column = "issued_at"),
        @Result(property = "expiresAt", column = "expires_at"),
        @Result(property = "consumedAt", column = "consumed_at")
    })
    AuthorizationCode findByCodeHash(@Param("codeHash") String codeHash);

    /**
     * Single-statement compare-and-set: only one concurrent caller can see an update count of 1.
     */
    @Update("""
        UPDATE authorization_codes
        SET consumed_at = #{now}
        WHERE id = #{id} AND consumed_at IS NULL AND expires_at > #{now}
        """)
    int markConsumed(@Param("id") String id, @Param("now") OffsetDateTime now);

    /**
     * Stamps expired codes that were never exchanged. The stamp is not earlier than expires_at,
     * which keeps them apart from exchanged codes.
     */
    @Update("""
        UPDATE authorization_codes
        SET consumed_at = #{now}
        WHERE consumed_at IS NULL AND expires_at <= #{now}
        """)
    int retireExpired(@Param("now") OffsetDateTime now);

    @Delete("""
        DELETE FROM authorization_codes
        WHERE expires_at < #{cutoff} AND consumed_at IS NOT NULL
        """)
    int deleteExpired(@Param("cutoff") OffsetDateTime cutoff);
}
