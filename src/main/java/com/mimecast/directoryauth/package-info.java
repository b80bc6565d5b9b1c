/**
 * Directory backed user authentication with SQL bookkeeping.
 *
 * <p>Users are entries in an LDAP directory and a bind as the user DN verifies the password.
 * <br>A relational database allocates numeric user ids, balances users across storage nodes
 * <br>and holds password reset codes.
 *
 * <h2>Packages:</h2>
 * <ul>
 *     <li>{@code auth} - the {@link com.mimecast.directoryauth.auth.AuthBackend} contract and its directory implementation.</li>
 *     <li>{@code ldap} - credential scoped directory connection pool.</li>
 *     <li>{@code node} - least loaded node selection.</li>
 *     <li>{@code resetcode} - reset code generation and storage.</li>
 *     <li>{@code config} - JSON5 configuration accessors.</li>
 * </ul>
 *
 * <h2>Configuration:</h2>
 * <pre>
 * {
 *   auth: {
 *     backend: "ldap",
 *     ldapUri: "ldap://localhost:389",
 *     bindUser: "cn=binduser,dc=mozilla",
 *     bindPassword: "secret",
 *     adminUser: "cn=admin,dc=mozilla",
 *     adminPassword: "secret",
 *     sql: {
 *       jdbcUrl: "jdbc:postgresql://localhost/auth"
 *     }
 *   }
 * }
 * </pre>
 *
 * @see com.mimecast.directoryauth.auth.AuthBackendFactory
 */
package com.mimecast.directoryauth;
