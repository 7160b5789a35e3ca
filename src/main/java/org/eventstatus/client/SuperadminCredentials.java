package org.eventstatus.client;

import org.eventstatus.config.utils.KeyProvider;

/**
 * Superadmin login used for privileged calls. The token, when present, only
 * seeds the client; it is refreshed or replaced at the start of each cleanup run.
 */
public record SuperadminCredentials(String email, String password, String token) {

    public static SuperadminCredentials fromEnvironment() {
        return new SuperadminCredentials(
                KeyProvider.getOptional("SUPERADMIN_EMAIL"),
                KeyProvider.getOptional("SUPERADMIN_PASSWORD"),
                KeyProvider.getOptional("SUPERADMIN_TOKEN")
        );
    }

    public static SuperadminCredentials none() {
        return new SuperadminCredentials(null, null, null);
    }

    public boolean canLogin() {
        return email != null && !email.isBlank() && password != null && !password.isBlank();
    }

    @Override
    public String toString() {
        return "SuperadminCredentials[email=" + email
                + ", password=" + (password == null ? "unset" : "****")
                + ", token=" + (token == null ? "unset" : "****") + "]";
    }
}
