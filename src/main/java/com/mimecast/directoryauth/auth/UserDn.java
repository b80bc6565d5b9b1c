package com.mimecast.directoryauth.auth;

import com.mimecast.directoryauth.config.DirectoryAuthConfig;
import com.unboundid.ldap.sdk.RDN;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Derives user entry DNs.
 *
 * <p>Plain layout: <code>uid=name,usersRoot</code>.
 * <br>Bucketed layout (usersRoot is <code>md5</code>): the first five hex characters of md5(name)
 * spread entries over nested <code>dc</code> levels, e.g.
 * <code>uid=tarek,dc=17507,dc=7507,dc=507,dc=07,dc=7,dc=mozilla</code>.
 */
public class UserDn {

    private static final int BUCKET_DEPTH = 5;

    private final String usersRoot;
    private final String usersBaseDn;

    /**
     * Constructs a new UserDn.
     *
     * @param usersRoot   Users root DN or <code>md5</code>.
     * @param usersBaseDn Base DN for bucketed entries.
     */
    public UserDn(String usersRoot, String usersBaseDn) {
        this.usersRoot = usersRoot;
        this.usersBaseDn = usersBaseDn;
    }

    /**
     * Constructs a new UserDn from configuration.
     *
     * @param config Backend configuration.
     */
    public UserDn(DirectoryAuthConfig config) {
        this(config.getUsersRoot(), config.getUsersBaseDn());
    }

    /**
     * Gets the DN of a user entry.
     *
     * @param userName User name.
     * @return DN string.
     */
    public String of(String userName) {
        String rdn = new RDN("uid", userName).toString();
        if (!isBucketed()) {
            return rdn + "," + usersRoot;
        }

        String hash = DigestUtils.md5Hex(userName.getBytes(StandardCharsets.UTF_8)).substring(0, BUCKET_DEPTH);
        StringBuilder sb = new StringBuilder(rdn);
        for (int pos = 0; pos < BUCKET_DEPTH; pos++) {
            sb.append(",dc=").append(hash.substring(pos));
        }
        return sb.append(',').append(usersBaseDn).toString();
    }

    /**
     * Gets the base of user searches.
     *
     * @return Search base DN.
     */
    public String searchBase() {
        return isBucketed() ? usersBaseDn : usersRoot;
    }

    private boolean isBucketed() {
        return DirectoryAuthConfig.MD5_USERS_ROOT.equals(usersRoot);
    }
}
