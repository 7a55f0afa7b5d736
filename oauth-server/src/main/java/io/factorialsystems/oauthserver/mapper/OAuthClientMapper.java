package io.factorialsystems.oauthserver.mapper;

import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.typehandler.StringListTypeHandler;
import org.apache.ibatis.annotations.*;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface OAuthClientMapper {

    @Select("""
        SELECT id, client_id, client_secret_hash, client_name, is_confidential, is_enabled, is_auto_approve,
               token_endpoint_auth_method, redirect_uris, grant_types, scopes,
               registration_access_token_hash, created_by, created_at, updated_at
        FROM oauth_clients
        WHERE client_id = #{clientId}
        """)
    @Results(id = "oauthClientResult", value = {
        @Result(property = "id", column = "id"),
        @Result(property = "clientId", column = "client_id"),
        @Result(property = "clientSecretHash", column = "client_secret_hash"),
        @Result(property = "clientName", column = "client_name"),
        @Result(property = "isConfidential", column = "is_confidential"),
        @Result(property = "isEnabled", column = "is_enabled"),
        @Result(property = "isAutoApprove", column = "is_auto_approve"),
        @Result(property = "tokenEndpointAuthMethod", column = "token_endpoint_auth_method"),
        @Result(property = "redirectUris", column = "redirect_uris", typeHandler = StringListTypeHandler.class),
        @Result(property = "grantTypes", column = "grant_types", typeHandler = StringListTypeHandler.class),
        @Result(property = "scopes", column = "scopes", typeHandler = StringListTypeHandler.class),
        @Result(property = "registrationAccessTokenHash", column = "registration_access_token_hash"),
        @Result(property = "createdBy", column = "created_by"),
        @Result(property = "createdAt", column = "created_at"),
        @Result(property = "updatedAt", column = "updated_at")
    })
    OAuthClient findByClientId(@Param("clientId") String clientId);

    @Select("""
        SELECT id, client_id, client_secret_hash, client_name, is_confidential, is_enabled, is_auto_approve,
               token_endpoint_auth_method, redirect_uris, grant_types, scopes,
               registration_access_token_hash, created_by, created_at, updated_at
        FROM oauth_clients
        ORDER BY created_at DESC
        """)
    @ResultMap("oauthClientResult")
    List<OAuthClient> findAll();

    @Insert("""
        INSERT INTO oauth_clients (
            id, client_id, client_secret_hash, client_name, is_confidential, is_enabled, is_auto_approve,
            token_endpoint_auth_method, redirect_uris, grant_types, scopes,
            registration_access_token_hash, created_by, created_at, updated_at
        ) VALUES (
            #{id}, #{clientId}, #{clientSecretHash}, #{clientName}, #{isConfidential}, #{isEnabled}, #{isAutoApprove},
            #{tokenEndpointAuthMethod},
            #{redirectUris,typeHandler=io.factorialsystems.oauthserver.typehandler.StringListTypeHandler},
            #{grantTypes,typeHandler=io.factorialsystems.oauthserver.typehandler.StringListTypeHandler},
            #{scopes,typeHandler=io.factorialsystems.oauthserver.typehandler.StringListTypeHandler},
            #{registrationAccessTokenHash}, #{createdBy}, #{createdAt}, #{updatedAt}
        )
        """)
    int insert(OAuthClient client);

    @Update("""
        UPDATE oauth_clients
        SET client_name = #{clientName},
            is_auto_approve = #{isAutoApprove},
            redirect_uris = #{redirectUris,typeHandler=io.factorialsystems.oauthserver.typehandler.StringListTypeHandler},
            grant_types = #{grantTypes,typeHandler=io.factorialsystems.oauthserver.typehandler.StringListTypeHandler},
            scopes = #{scopes,typeHandler=io.factorialsystems.oauthserver.typehandler.StringListTypeHandler},
            updated_at = #{updatedAt}
        WHERE client_id = #{clientId}
        """)
    int updateMetadata(OAuthClient client);

    @Update("""
        UPDATE oauth_clients
        SET is_enabled = #{enabled}, updated_at = #{updatedAt}
        WHERE client_id = #{clientId}
        """)
    int updateEnabled(@Param("clientId") String clientId, @Param("enabled") boolean enabled,
                      @Param("updatedAt") OffsetDateTime updatedAt);

    @Update("""
        UPDATE oauth_clients
        SET client_secret_hash = #{secretHash}, updated_at = #{updatedAt}
        WHERE client_id = #{clientId}
        """)
    int updateSecretHash(@Param("clientId") String clientId, @Param("secretHash") String secretHash,
                         @Param("updatedAt") OffsetDateTime updatedAt);
}
