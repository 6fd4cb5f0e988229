package com.graplsub.client;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Per-run Subsonic credentials for token authentication.
 * <p>
 * The protocol never sends the password itself. Instead:
 * <ul>
 *   <li>3 random bytes are drawn and hex-encoded into a 6 character salt.</li>
 *   <li>The salt is appended to the password and the result hashed: {@code md5(password + salt)}.</li>
 *   <li>User, token and salt go on every request as {@code u}, {@code t} and {@code s}.</li>
 * </ul>
 * The salt only needs to differ between runs, so one value is derived at startup and reused.
 *
 * @param user      Subsonic user name
 * @param salt      6 lowercase hex characters
 * @param authToken 32 lowercase hex characters
 * @author graplsub maintainers
 * @since 0.1
 */
public record SessionCredentials(String user, String salt, String authToken) {
    static final int SALT_BYTES = 3;

    private static final Random RANDOM = new SecureRandom();

    /**
     * Derives credentials with a fresh random salt.
     * @param user Subsonic user name
     * @param password Plaintext password
     * @return Credentials for this run
     */
    public static SessionCredentials derive(String user, String password) {
        return derive(user, password, RANDOM);
    }

    /**
     * Derives credentials drawing the salt from the given source.
     * @param user Subsonic user name
     * @param password Plaintext password
     * @param random Source of the salt bytes
     * @return Credentials for this run
     */
    public static SessionCredentials derive(String user, String password, Random random) {
        byte[] bytes = new byte[SALT_BYTES];
        random.nextBytes(bytes);
        String salt = Utils.toHex(bytes);
        return new SessionCredentials(user, salt, Utils.md5Hex(password + salt));
    }

    @Override
    public String toString() {
        return "SessionCredentials[user=" + user + ", salt=******, authToken=******]";
    }
}
