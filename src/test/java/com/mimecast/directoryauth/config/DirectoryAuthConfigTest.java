package com.mimecast.directoryauth.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryAuthConfigTest {

    @Test
    void defaults() {
        DirectoryAuthConfig config = new DirectoryAuthConfig();

        assertEquals("ldap", config.getBackend());
        assertEquals("ldap://localhost", config.getLdapUri());
        assertFalse(config.isUseTls());
        assertEquals("binduser", config.getBindUser());
        assertEquals("binduser", config.getBindPassword());
        assertEquals("adminuser", config.getAdminUser());
        assertEquals("adminuser", config.getAdminPassword());
        assertEquals("ou=users,dc=mozilla", config.getUsersRoot());
        assertNull(config.getUsersBaseDn());
        assertEquals(-1, config.getLdapTimeout());
        assertEquals(10, config.getLdapPoolSize());
        assertTrue(config.isLdapUsePool());
        assertEquals(3, config.getLdapRetryMax());
        assertEquals(Duration.ofMillis(100), config.getLdapRetryDelay());
        assertFalse(config.isSingleBox());
        assertEquals("https", config.getNodesScheme());
        assertTrue(config.isCheckAccountState());
        assertTrue(config.isCreateTables());
        assertNull(config.getSqlJdbcUrl());
        assertEquals(100, config.getSqlPoolSize());
        assertEquals(3600L, config.getSqlPoolRecycle());
    }

    @Test
    void fromNamespaceOfFile() throws IOException {
        DirectoryAuthConfig config = DirectoryAuthConfig.fromNamespace(
                new ConfigFoundation("src/test/resources/cfg/auth.json5"), "auth");

        assertEquals("ldap://directory.example.com:389", config.getLdapUri());
        assertTrue(config.isUseTls());
        assertEquals("cn=admin,dc=mozilla", config.getAdminUser());
        assertEquals(DirectoryAuthConfig.MD5_USERS_ROOT, config.getUsersRoot());
        assertEquals("dc=mozilla", config.getUsersBaseDn());
        assertEquals(5, config.getLdapTimeout());
        assertEquals(4, config.getLdapPoolSize());
        assertEquals(Duration.ofMillis(250), config.getLdapRetryDelay());
        assertEquals("http", config.getNodesScheme());
        assertFalse(config.isCheckAccountState());
        assertEquals("jdbc:h2:mem:cfg;MODE=PostgreSQL", config.getSqlJdbcUrl());
        assertEquals(8, config.getSqlPoolSize());
        assertEquals(10L, config.getSqlPoolRecycle());
        assertEquals("binduser", config.getBindUser());
    }
}
