package com.mimecast.directoryauth.ldap;

import com.unboundid.ldap.sdk.LDAPException;

/**
 * Creates one directory client per pool entry.
 */
@FunctionalInterface
public interface DirectoryClientFactory {

    /**
     * Creates a new client.
     *
     * @return DirectoryClient instance.
     * @throws LDAPException Unable to create the client.
     */
    DirectoryClient create() throws LDAPException;
}
