package com.bank.categorization.engine;

import com.bank.categorization.model.TransactionInput;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns raw statement text into the signature, keywords and fingerprint used by
 * routing and by the pattern learner. Both sides must normalize identically, so
 * there is exactly one implementation.
 */
@Component
public class InputNormalizer {

    static final int MAX_KEYWORDS = 5;
    private static final int SIGNATURE_FALLBACK_KEYWORDS = 2;

    private static final Set<String> STOP_WORDS = Set.of(
            "THE", "AND", "FOR", "FROM", "WITH", "PAYMENT", "PURCHASE", "POS", "EFT", "DEBIT",
            "CREDIT", "ORDER", "TRANSFER", "REF", "INV", "PTY", "LTD", "CARD");

    public NormalizedInput normalize(TransactionInput input) {
        String payee = safe(input.getPayeeName());
        String description = safe(input.getDescription());

        List<String> keywords = keywords(description);
        String signature = signature(payee);
        if (signature.isEmpty() && !keywords.isEmpty()) {
            signature = String.join(" ", keywords.subList(0, Math.min(SIGNATURE_FALLBACK_KEYWORDS, keywords.size())));
        }

        String inputText = payee.isBlank() ? description.trim() : (payee.trim() + " | " + description.trim());
        return new NormalizedInput(signature, keywords, inputHash(input), inputText);
    }

    /**
     * Upper-cased counterparty with punctuation stripped and whitespace collapsed.
     */
    public String signature(String payeeName) {
        if (payeeName == null) return "";
        return payeeName.toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z0-9 ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    public List<String> keywords(String description) {
        if (description == null || description.isBlank()) return List.of();
        Set<String> unique = new LinkedHashSet<>();
        for (String token : description.toUpperCase(Locale.ROOT).split("[^A-Z0-9]+")) {
            if (token.length() <= 2 || STOP_WORDS.contains(token) || token.chars().allMatch(Character::isDigit)) {
                continue;
            }
            unique.add(token);
            if (unique.size() == MAX_KEYWORDS) break;
        }
        return new ArrayList<>(unique);
    }

    /**
     * SHA-256 of payee, description, amount and direction after trimming and lower-casing.
     */
    public String inputHash(TransactionInput input) {
        String canonical = safe(input.getPayeeName()).trim().toLowerCase(Locale.ROOT)
                + "|" + safe(input.getDescription()).trim().toLowerCase(Locale.ROOT)
                + "|" + input.getAmountCents()
                + "|" + (input.isCredit() ? "C" : "D");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
