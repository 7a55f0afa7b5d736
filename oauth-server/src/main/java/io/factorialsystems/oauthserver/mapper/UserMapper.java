package io.factorialsystems.oauthserver.mapper;

import io.factorialsystems.oauthserver.model.User;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface UserMapper {

    @Select("""
        SELECT id, username, email, password, is_active, created_at, updated_at
        FROM users
        WHERE username = #{username} AND is_active = true
        """)
    @Results(id = "userResult", value = {
        @Result(property = "id", column = "id"),
        @Result(property = "username", column = "username"),
        @Result(property = "email", column = "email"),
        @Result(property = "password", column = "password"),
        @Result(property = "isActive", column = "is_active"),
        @Result(property = "createdAt", column = "created_at"),
        @Result(property = "updatedAt", column = "updated_at"),
        @Result(property = "permissions", column = "id", javaType = List.class,
                many = @Many(select = "findPermissionsByUserId"))
    })
    User findByUsername(@Param("username") String username);

    @Select("""
        SELECT id, username, email, password, is_active, created_at, updated_at
        FROM users
        WHERE id = #{id}
        """)
    @ResultMap("userResult")
    User findById(@Param("id") String id);

    @Select("""
        SELECT permission
        FROM user_permissions
        WHERE user_id = #{userId}
        """)
    List<String> findPermissionsByUserId(@Param("userId") String userId);
}
