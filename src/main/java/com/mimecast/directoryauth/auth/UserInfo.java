package com.mimecast.directoryauth.auth;

import java.util.Objects;

/**
 * User name and email of an account.
 */
public class UserInfo {

    private final String userName;
    private final String email;

    /**
     * Constructs a new UserInfo.
     *
     * @param userName User name.
     * @param email    Email, may be null.
     */
    public UserInfo(String userName, String email) {
        this.userName = userName;
        this.email = email;
    }

    public String getUserName() {
        return userName;
    }

    public String getEmail() {
        return email;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserInfo)) return false;
        UserInfo other = (UserInfo) o;
        return Objects.equals(userName, other.userName) && Objects.equals(email, other.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userName, email);
    }

    @Override
    public String toString() {
        return "UserInfo{userName='" + userName + "', email='" + email + "'}";
    }
}
