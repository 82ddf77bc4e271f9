package com.example.librarypanels.uid;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/** Nine characters drawn from a URL-safe alphabet. */
@Component
public class ShortUidGenerator implements UidGenerator {

    static final int LENGTH = 9;
    static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ_-";

    private final SecureRandom random = new SecureRandom();

    @Override
    public String generate() {
        StringBuilder uid = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            uid.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return uid.toString();
    }
}
