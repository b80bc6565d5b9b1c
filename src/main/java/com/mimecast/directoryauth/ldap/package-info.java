/**
 * Directory connection pool.
 *
 * <p>Connections are keyed by the identity they are bound with.
 * <br>A request for an identity reuses an idle connection already bound as it, or rebinds an idle unbound one.
 * <br>New connections are only opened while the pool is below capacity.
 *
 * <p>Returning a connection always unbinds it, so an idle connection never carries a user's credentials.
 * <br>Connections that lost their server are dropped on return.
 *
 * @see com.mimecast.directoryauth.ldap.ConnectionPool
 */
package com.mimecast.directoryauth.ldap;
