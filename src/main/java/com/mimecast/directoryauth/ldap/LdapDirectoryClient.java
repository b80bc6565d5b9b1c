package com.mimecast.directoryauth.ldap;

import com.unboundid.ldap.sdk.Entry;
import com.unboundid.ldap.sdk.ExtendedResult;
import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPConnectionOptions;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.LDAPURL;
import com.unboundid.ldap.sdk.Modification;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.ldap.sdk.SearchRequest;
import com.unboundid.ldap.sdk.SearchResult;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;
import com.unboundid.ldap.sdk.extensions.StartTLSExtendedRequest;
import com.unboundid.util.ssl.SSLUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLContext;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * DirectoryClient backed by an UnboundID {@link LDAPConnection}.
 *
 * <p>The socket is opened lazily and closed on unbind, mirroring LDAP unbind semantics.
 * <br>Once StartTLS was requested it is negotiated again on every reopened socket.
 */
public class LdapDirectoryClient implements DirectoryClient {
    private static final Logger log = LogManager.getLogger(LdapDirectoryClient.class);

    private final LDAPURL url;
    private final LDAPConnectionOptions options;

    private LDAPConnection connection;
    private boolean tls;

    /**
     * Constructs a new LdapDirectoryClient.
     *
     * @param uri            Directory URI, ldap:// or ldaps://.
     * @param timeoutSeconds Response timeout in seconds, zero or negative for none.
     * @throws LDAPException Malformed URI.
     */
    public LdapDirectoryClient(String uri, int timeoutSeconds) throws LDAPException {
        this.url = new LDAPURL(uri);
        this.options = new LDAPConnectionOptions();
        if (timeoutSeconds > 0) {
            long millis = TimeUnit.SECONDS.toMillis(timeoutSeconds);
            options.setResponseTimeoutMillis(millis);
            options.setConnectTimeoutMillis(Math.toIntExact(millis));
        }
    }

    /**
     * Creates a factory producing clients for the given URI.
     *
     * @param uri            Directory URI.
     * @param timeoutSeconds Response timeout in seconds.
     * @return DirectoryClientFactory instance.
     */
    public static DirectoryClientFactory factory(String uri, int timeoutSeconds) {
        return () -> new LdapDirectoryClient(uri, timeoutSeconds);
    }

    @Override
    public synchronized void startTls() throws LDAPException {
        boolean live = connection != null && connection.isConnected();
        if (tls && live) {
            return;
        }
        tls = true;
        if (live && !isLdaps()) {
            negotiateTls(connection);
        } else if (live) {
            return;
        } else {
            open();
        }
    }

    @Override
    public synchronized void bind(String dn, String password) throws LDAPException {
        open().bind(dn == null ? "" : dn, password == null ? "" : password);
    }

    @Override
    public synchronized void unbind() {
        if (connection != null) {
            // LDAPConnection.close() sends the unbind request before closing the socket.
            connection.close();
            connection = null;
        }
    }

    @Override
    public synchronized List<SearchResultEntry> search(String baseDn, SearchScope scope, String filter,
                                                       int timeLimitSeconds, String... attributes) throws LDAPException {
        SearchRequest request = new SearchRequest(baseDn, scope, filter, attributes);
        if (timeLimitSeconds > 0) {
            request.setTimeLimitSeconds(timeLimitSeconds);
        }
        SearchResult result = open().search(request);
        return result.getSearchEntries();
    }

    @Override
    public synchronized ResultCode add(Entry entry) throws LDAPException {
        return open().add(entry).getResultCode();
    }

    @Override
    public synchronized ResultCode modify(String dn, Modification... modifications) throws LDAPException {
        return open().modify(dn, modifications).getResultCode();
    }

    @Override
    public synchronized ResultCode delete(String dn) throws LDAPException {
        return open().delete(dn).getResultCode();
    }

    @Override
    public synchronized void close() {
        unbind();
    }

    /**
     * Returns the live connection, opening a new one if needed.
     *
     * @return LDAPConnection instance.
     * @throws LDAPException Unable to connect.
     */
    private LDAPConnection open() throws LDAPException {
        if (connection != null && connection.isConnected()) {
            return connection;
        }

        LDAPConnection opened;
        if (isLdaps()) {
            opened = new LDAPConnection(sslContext().getSocketFactory(), options, url.getHost(), url.getPort());
        } else {
            opened = new LDAPConnection(options, url.getHost(), url.getPort());
        }
        log.trace("Opened directory connection to {}:{}", url.getHost(), url.getPort());

        if (tls && !isLdaps()) {
            negotiateTls(opened);
        }
        connection = opened;
        return opened;
    }

    /**
     * Checks if the URI asks for TLS from the first byte.
     *
     * @return True for ldaps://.
     */
    private boolean isLdaps() {
        return "ldaps".equalsIgnoreCase(url.getScheme());
    }

    /**
     * Negotiates StartTLS on a plain connection.
     *
     * @param target Connection to upgrade.
     * @throws LDAPException Negotiation failed.
     */
    private void negotiateTls(LDAPConnection target) throws LDAPException {
        ExtendedResult result = target.processExtendedOperation(new StartTLSExtendedRequest(sslContext()));
        if (result.getResultCode() != ResultCode.SUCCESS) {
            log.warn("StartTLS operation failed for server {}:{}", url.getHost(), url.getPort());
            target.close();
            throw new LDAPException(ResultCode.CONNECT_ERROR, "StartTLS failed: " + result.getDiagnosticMessage());
        }
    }

    /**
     * Builds an SSL context trusting the JVM default trust store.
     *
     * @return SSLContext instance.
     * @throws LDAPException Unable to initialize TLS.
     */
    private SSLContext sslContext() throws LDAPException {
        try {
            return new SSLUtil().createSSLContext();
        } catch (GeneralSecurityException e) {
            throw new LDAPException(ResultCode.LOCAL_ERROR, "Unable to initialize TLS: " + e.getMessage(), e);
        }
    }
}
