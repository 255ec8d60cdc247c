package com.crypto.connector.common.validation;

import com.crypto.connector.common.auth.PemKeys;
import com.crypto.connector.common.exchange.CoinbaseApiFamily;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.model.Credentials;

import java.util.ArrayList;
import java.util.List;

/**
 * Offline format checks run before any connection test. Hard failures make the result
 * invalid; softer oddities are reported as warnings.
 */
public class CredentialFormatValidator {

    public ValidationResult validate(ExchangeProvider provider, String apiFamily, Credentials raw) {
        List<String> warnings = new ArrayList<>();
        String apiKey = CredentialSanitizer.sanitizeApiKey(raw.apiKey);
        String apiSecret = CredentialSanitizer.sanitizeSecret(raw.apiSecret);
        String passphrase = CredentialSanitizer.sanitizePassphrase(raw.apiPassphrase);
        Credentials sanitized = new Credentials(apiKey, apiSecret, passphrase);

        if (provider == null) {
            return ValidationResult.invalid("Provider is required", warnings, sanitized);
        }
        if (apiKey.length() < 10) {
            return ValidationResult.invalid("API Key appears too short. Please check your credentials.", warnings, sanitized);
        }
        boolean pemSecret = PemKeys.isPem(apiSecret);
        if (!pemSecret && apiSecret.length() < 10) {
            return ValidationResult.invalid("API Secret appears too short. Please check your credentials.", warnings, sanitized);
        }
        if (pemSecret && apiSecret.length() < 100) {
            return ValidationResult.invalid(
                    "Private key appears too short. Please verify the complete PEM-encoded key was pasted.",
                    warnings, sanitized);
        }
        if (apiKey.contains("BEGIN") || apiKey.contains("PRIVATE KEY")) {
            return ValidationResult.invalid(
                    "API Key should not be a PEM-encoded private key. The API key should be a simple string identifier.",
                    warnings, sanitized);
        }

        String error = checkProvider(provider, apiFamily, sanitized, pemSecret, warnings);
        if (error != null) {
            return ValidationResult.invalid(error, warnings, sanitized);
        }

        if ((apiSecret.contains("BEGIN") || apiSecret.contains("PRIVATE KEY"))
                && (!apiSecret.contains("-----BEGIN") || !apiSecret.contains("-----END"))) {
            warnings.add("Private key appears to be malformed. Please verify the PEM format is correct.");
        }
        if (apiKey.contains("@") || apiKey.contains("http")) {
            warnings.add("API Key contains unusual characters. Please verify this is correct.");
        }
        if (apiSecret.contains("@") || apiSecret.contains("http")) {
            warnings.add("API Secret contains unusual characters. Please verify this is correct.");
        }
        return ValidationResult.valid(warnings, sanitized);
    }

    private String checkProvider(ExchangeProvider provider, String apiFamily, Credentials c, boolean pemSecret,
                                 List<String> warnings) {
        switch (provider) {
            case BINANCE -> {
                if (!pemSecret && (c.apiKey.length() < 32 || c.apiKey.length() > 128)) {
                    warnings.add("Binance US API keys are typically 32-128 characters. Please verify your key.");
                }
                if (!pemSecret && (c.apiSecret.length() < 32 || c.apiSecret.length() > 128)) {
                    warnings.add("Binance US API secrets are typically 32-128 characters. Please verify your secret.");
                }
                if (pemSecret) {
                    warnings.add("Binance US typically uses simple string API keys, not PEM-encoded keys. Please verify this is correct.");
                }
            }
            case KRAKEN -> {
                if (!pemSecret && (c.apiKey.length() < 40 || c.apiKey.length() > 80)) {
                    warnings.add("Kraken API keys are typically 40-80 characters. Please verify your key.");
                }
                if (pemSecret) {
                    warnings.add("Kraken typically uses simple string API keys, not PEM-encoded keys. Please verify this is correct.");
                }
            }
            case COINBASE -> {
                return checkCoinbase(CoinbaseApiFamily.from(apiFamily), c, pemSecret, warnings);
            }
            default -> {
            }
        }
        return null;
    }

    private String checkCoinbase(CoinbaseApiFamily family, Credentials c, boolean pemSecret, List<String> warnings) {
        boolean cdpName = CredentialJsonParser.isCdpKeyName(c.apiKey);
        switch (family) {
            case ADVANCED_TRADE -> {
                if (!cdpName) {
                    return "Coinbase Advanced Trade requires the modern API key format (name field with "
                            + "organizations/.../apiKeys/... path). Please use the JSON format with name and privateKey fields.";
                }
                if (!pemSecret) {
                    return "Coinbase Advanced Trade requires a PEM-encoded private key. "
                            + "Please use the JSON format with name and privateKey fields.";
                }
            }
            case EXCHANGE -> {
                if (cdpName) {
                    warnings.add("You're using the modern API key format (name/privateKey). "
                            + "Consider using 'Coinbase Advanced Trade' instead of Coinbase Exchange.");
                }
                if (pemSecret) {
                    warnings.add("Coinbase Exchange typically uses simple string API keys, not PEM-encoded keys. "
                            + "Please verify this is correct.");
                }
                if (!pemSecret && (c.apiKey.length() < 20 || c.apiKey.length() > 100)) {
                    warnings.add("Coinbase API keys are typically 20-100 characters. Please verify your key.");
                }
                if (!c.hasPassphrase()) {
                    return "Coinbase Exchange requires an API Passphrase. "
                            + "If using modern format (name/privateKey), use 'Coinbase Advanced Trade' instead.";
                }
            }
            case APP, SERVER_WALLET, TRADE_API -> {
                if (cdpName && !pemSecret) {
                    warnings.add("CDP API format should include a PEM-encoded private key. Please verify your credentials.");
                }
            }
        }
        return null;
    }
}
