package com.tedu.juryportal.modules.credential;

import java.util.Optional;

/**
 * Key-value store backing juror credentials. Implementations must offer
 * read-after-write consistency per key; nothing else is assumed.
 */
public interface CredentialStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void delete(String key);
}
