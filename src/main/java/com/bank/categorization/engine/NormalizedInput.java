package com.bank.categorization.engine;

import java.util.List;

/**
 * Matching features derived from one transaction.
 *
 * @param signature normalized counterparty, upper case, used as the rule key
 * @param keywords  significant description words, upper case, at most five
 * @param inputHash SHA-256 hex of the normalized input
 * @param inputText text handed to inference and used for rule description matching
 */
public record NormalizedInput(String signature, List<String> keywords, String inputHash, String inputText) {
}
