package com.mimecast.directoryauth.ldap;

import com.unboundid.ldap.sdk.Entry;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.Modification;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;

import java.util.List;

/**
 * One directory session owned by a {@link ConnectionPool}.
 *
 * <p>Tracks the bound identity and liveness as pool bookkeeping.
 * <br>Operations are delegated to the {@link DirectoryClient}; a lost connection
 * flips {@link #isConnected()} so the pool drops the entry on release.
 */
public class DirectoryConnection {

    private final DirectoryClient client;
    private final CleanupListener cleanupListener;

    private volatile String boundIdentity;
    private volatile String boundSecret;
    private volatile boolean active;
    private volatile boolean connected;

    /**
     * Constructs a new DirectoryConnection.
     *
     * @param client          Directory client.
     * @param cleanupListener Listener for ignored unbind errors.
     */
    DirectoryConnection(DirectoryClient client, CleanupListener cleanupListener) {
        this.client = client;
        this.cleanupListener = cleanupListener;
    }

    /**
     * Binds the session.
     * <p>State is only updated on success.
     *
     * @param identity Bind DN.
     * @param secret   Password.
     * @throws LDAPException Bind failed.
     */
    public void bind(String identity, String secret) throws LDAPException {
        client.bind(identity, secret);
        connected = true;
        boundIdentity = identity;
        boundSecret = secret;
    }

    /**
     * Unbinds the session.
     * <p>State is always cleared, errors go to the cleanup listener.
     */
    public void unbind() {
        String identity = boundIdentity;
        try {
            client.unbind();
        } catch (LDAPException e) {
            cleanupListener.cleanupFailed(identity, e);
        } finally {
            connected = false;
            boundIdentity = null;
            boundSecret = null;
        }
    }

    /**
     * Upgrades the transport with StartTLS.
     *
     * @throws LDAPException Negotiation failed.
     */
    public void startTls() throws LDAPException {
        try {
            client.startTls();
        } catch (LDAPException e) {
            track(e);
            throw e;
        }
    }

    /**
     * Searches the directory.
     *
     * @param baseDn           Search base.
     * @param scope            Search scope.
     * @param filter           Filter string.
     * @param timeLimitSeconds Time limit, zero or negative for none.
     * @param attributes       Attributes to return.
     * @return Matching entries.
     * @throws LDAPException Search failed.
     */
    public List<SearchResultEntry> search(String baseDn, SearchScope scope, String filter, int timeLimitSeconds,
                                          String... attributes) throws LDAPException {
        try {
            return client.search(baseDn, scope, filter, timeLimitSeconds, attributes);
        } catch (LDAPException e) {
            track(e);
            throw e;
        }
    }

    /**
     * Adds an entry.
     *
     * @param entry Entry to add.
     * @return Result code.
     * @throws LDAPException Add failed.
     */
    public ResultCode add(Entry entry) throws LDAPException {
        try {
            return client.add(entry);
        } catch (LDAPException e) {
            track(e);
            throw e;
        }
    }

    /**
     * Modifies an entry.
     *
     * @param dn            Entry DN.
     * @param modifications Modifications.
     * @return Result code.
     * @throws LDAPException Modify failed.
     */
    public ResultCode modify(String dn, Modification... modifications) throws LDAPException {
        try {
            return client.modify(dn, modifications);
        } catch (LDAPException e) {
            track(e);
            throw e;
        }
    }

    /**
     * Deletes an entry.
     *
     * @param dn Entry DN.
     * @return Result code.
     * @throws LDAPException Delete failed.
     */
    public ResultCode delete(String dn) throws LDAPException {
        try {
            return client.delete(dn);
        } catch (LDAPException e) {
            track(e);
            throw e;
        }
    }

    /**
     * Unbinds and releases the client for good.
     */
    void discard() {
        unbind();
        client.close();
    }

    /**
     * Marks the session dead when the error says the connection is gone.
     */
    private void track(LDAPException e) {
        if (LdapErrors.isConnectionLost(e)) {
            connected = false;
        }
    }

    public String getBoundIdentity() {
        return boundIdentity;
    }

    String getBoundSecret() {
        return boundSecret;
    }

    public boolean isActive() {
        return active;
    }

    void setActive(boolean active) {
        this.active = active;
    }

    /**
     * Checks the session is bound and not known to be dead.
     *
     * @return True between a successful bind and the next unbind or lost connection.
     */
    public boolean isConnected() {
        return connected;
    }

    /**
     * Flags the session as dead, it will be dropped on release.
     */
    public void markDisconnected() {
        this.connected = false;
    }
}
