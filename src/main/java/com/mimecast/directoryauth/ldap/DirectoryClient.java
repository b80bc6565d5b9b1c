package com.mimecast.directoryauth.ldap;

import com.unboundid.ldap.sdk.Entry;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.Modification;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;

import java.io.Closeable;
import java.util.List;

/**
 * Directory protocol client for a single session.
 *
 * <p>Failures are reported as {@link LDAPException} and classified by {@link LdapErrors}.
 * <p>Unbinding ends the session; the next bind or operation opens a new one.
 *
 * @see LdapDirectoryClient
 */
public interface DirectoryClient extends Closeable {

    /**
     * Upgrades the transport with StartTLS.
     *
     * @throws LDAPException Negotiation failed.
     */
    void startTls() throws LDAPException;

    /**
     * Performs a simple bind.
     *
     * @param dn       Bind DN, null or empty for anonymous.
     * @param password Password.
     * @throws LDAPException Bind failed.
     */
    void bind(String dn, String password) throws LDAPException;

    /**
     * Ends the session.
     *
     * @throws LDAPException Protocol error while closing.
     */
    void unbind() throws LDAPException;

    /**
     * Searches the directory.
     *
     * @param baseDn           Search base.
     * @param scope            Search scope.
     * @param filter           Filter string.
     * @param timeLimitSeconds Server side time limit, zero or negative for none.
     * @param attributes       Attributes to return.
     * @return Matching entries, never null.
     * @throws LDAPException Search failed.
     */
    List<SearchResultEntry> search(String baseDn, SearchScope scope, String filter, int timeLimitSeconds,
                                   String... attributes) throws LDAPException;

    /**
     * Adds an entry.
     *
     * @param entry Entry to add.
     * @return Result code.
     * @throws LDAPException Add failed.
     */
    ResultCode add(Entry entry) throws LDAPException;

    /**
     * Modifies an entry.
     *
     * @param dn            Entry DN.
     * @param modifications Modifications to apply.
     * @return Result code.
     * @throws LDAPException Modify failed.
     */
    ResultCode modify(String dn, Modification... modifications) throws LDAPException;

    /**
     * Deletes an entry.
     *
     * @param dn Entry DN.
     * @return Result code.
     * @throws LDAPException Delete failed.
     */
    ResultCode delete(String dn) throws LDAPException;

    /**
     * Releases the underlying socket, if any.
     */
    @Override
    void close();
}
